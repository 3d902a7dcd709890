package com.linlay.analysisagent.sandbox.python;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.analysisagent.config.RunnerProperties;
import com.linlay.analysisagent.config.SandboxProperties;
import com.linlay.analysisagent.sandbox.CodeSandbox;
import com.linlay.analysisagent.sandbox.DataTable;
import com.linlay.analysisagent.sandbox.OutputLimiter;
import com.linlay.analysisagent.sandbox.ResultValue;
import com.linlay.analysisagent.sandbox.SandboxErrorKind;
import com.linlay.analysisagent.sandbox.SandboxFigure;
import com.linlay.analysisagent.sandbox.SandboxRequest;
import com.linlay.analysisagent.sandbox.SandboxResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Runs Python in a separate worker process.
 * <p>
 * stdout is drained on a background thread while the result queue is polled. Waiting for exit first
 * would deadlock once a large result fills the pipe.
 */
@Component
public class PythonSandboxExecutor implements CodeSandbox {

    private static final Logger log = LoggerFactory.getLogger(PythonSandboxExecutor.class);

    static final String WORKER_RESOURCE = "sandbox/python_sandbox_worker.py";
    static final String RESULT_MARKER = "@@SANDBOX_RESULT@@";

    private final ObjectMapper objectMapper;
    private final SandboxProperties.Python settings;
    private final int maxOutputChars;
    private final Path sessionsDir;
    private final Object workerScriptLock = new Object();
    private volatile Path workerScript;

    @Autowired
    public PythonSandboxExecutor(ObjectMapper objectMapper, SandboxProperties properties, RunnerProperties runnerProperties) {
        this(objectMapper, properties.getPython(), properties.getMaxOutputChars(), Path.of(runnerProperties.getSessionsDir()));
    }

    PythonSandboxExecutor(ObjectMapper objectMapper, SandboxProperties.Python settings, int maxOutputChars, Path sessionsDir) {
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.maxOutputChars = maxOutputChars;
        this.sessionsDir = sessionsDir.toAbsolutePath().normalize();
    }

    @Override
    public String language() {
        return "python";
    }

    @Override
    public SandboxResult execute(SandboxRequest request) {
        Optional<String> violation = PythonCodePolicy.check(request.code());
        if (violation.isPresent()) {
            log.info("python sandbox rejected code, session={}, reason={}", request.sessionId(), violation.get());
            return SandboxResult.failure(SandboxErrorKind.POLICY, "code rejected by sandbox policy: " + violation.get());
        }

        long timeoutMs = request.timeoutMs() == null || request.timeoutMs() <= 0 ? settings.getTimeoutMs() : request.timeoutMs();
        int memoryLimitMb = resolveMemoryLimit(request.maxMemoryMb() == null ? settings.getMaxMemoryMb() : request.maxMemoryMb());

        Path workdir;
        Path script;
        byte[] payload;
        try {
            workdir = Files.createDirectories(sessionsDir.resolve(safeSegment(request.sessionId())).resolve("sandbox_tmp"));
            script = workerScript();
            payload = objectMapper.writeValueAsBytes(buildWorkerRequest(request, workdir, timeoutMs, memoryLimitMb));
        } catch (IOException ex) {
            log.warn("python sandbox preparation failed, session={}", request.sessionId(), ex);
            return SandboxResult.failure(SandboxErrorKind.CONFIGURATION, "sandbox preparation failed: " + safeMessage(ex));
        }

        long startNanos = System.nanoTime();
        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(settings.getCommand(), "-I", "-u", script.toString())
                    .directory(workdir.toFile());
            builder.environment().put("MPLBACKEND", "Agg");
            builder.environment().put("OPENBLAS_NUM_THREADS", "1");
            builder.environment().put("OMP_NUM_THREADS", "1");
            process = builder.start();
        } catch (IOException ex) {
            log.warn("python interpreter unavailable, command={}", settings.getCommand(), ex);
            return SandboxResult.failure(SandboxErrorKind.CONFIGURATION,
                    "python interpreter not available (" + settings.getCommand() + "): " + safeMessage(ex));
        }
        log.debug("python sandbox started, session={}, pid={}, timeoutMs={}, memoryLimitMb={}",
                request.sessionId(), process.pid(), timeoutMs, memoryLimitMb);

        EnvelopeReader envelopeReader = new EnvelopeReader(process.getInputStream(), maxOutputChars);
        Thread stdoutThread = new Thread(envelopeReader, "python-sandbox-stdout");
        stdoutThread.setDaemon(true);
        stdoutThread.start();
        OutputLimiter stderrCollector = new OutputLimiter(process.getErrorStream(), maxOutputChars);
        Thread stderrThread = OutputLimiter.start(stderrCollector, "python-sandbox-stderr");

        // the deadline covers the request write, a worker that never drains stdin still times out
        long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        Thread stdinThread = new Thread(() -> writeRequest(process, payload), "python-sandbox-stdin");
        stdinThread.setDaemon(true);
        stdinThread.start();

        try {
            String message = awaitEnvelope(process, envelopeReader, stdoutThread, deadlineNanos);
            if (message == null && process.isAlive()) {
                terminate(process);
                joinQuietly(stderrThread);
                log.info("python sandbox timed out, session={}, timeoutMs={}", request.sessionId(), timeoutMs);
                return SandboxResult.failure(SandboxErrorKind.TIMEOUT,
                        "code execution timed out after " + Math.max(1, timeoutMs / 1000) + " seconds",
                        null, envelopeReader.strayOutput(), stderrCollector.text());
            }

            // bounded join after the result, then force kill
            if (!process.waitFor(settings.getJoinTimeoutMs(), TimeUnit.MILLISECONDS)) {
                terminate(process);
            }
            joinQuietly(stderrThread);

            if (message == null) {
                String stderr = stderrCollector.text();
                int exitCode = process.isAlive() ? -1 : process.exitValue();
                log.warn("python sandbox crashed, session={}, exitCode={}", request.sessionId(), exitCode);
                return SandboxResult.failure(SandboxErrorKind.CRASH,
                        "sandbox worker exited without a result (exit code " + exitCode + ")"
                                + (stderr.isBlank() ? "" : ": " + tail(stderr)),
                        null, envelopeReader.strayOutput(), stderr);
            }

            SandboxResult result = decodeEnvelope(message, envelopeReader.strayOutput(), stderrCollector.text());
            log.info("python sandbox finished, session={}, success={}, elapsedMs={}",
                    request.sessionId(), result.success(), (System.nanoTime() - startNanos) / 1_000_000);
            return result;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            terminate(process);
            return SandboxResult.failure(SandboxErrorKind.CRASH, "sandbox execution interrupted");
        }
    }

    // null with a live process means timeout, otherwise the worker crashed
    private String awaitEnvelope(Process process, EnvelopeReader reader, Thread readerThread, long deadlineNanos)
            throws InterruptedException {
        while (true) {
            String message = reader.envelopes().poll(settings.getPollIntervalMs(), TimeUnit.MILLISECONDS);
            if (message != null) {
                return message;
            }
            if (!process.isAlive()) {
                // exited: let the reader drain the pipe, then poll once more
                readerThread.join(settings.getJoinTimeoutMs());
                return reader.envelopes().poll();
            }
            if (System.nanoTime() >= deadlineNanos) {
                return null;
            }
        }
    }

    int resolveMemoryLimit(int requestedMb) {
        if (requestedMb <= 0) {
            return 0;
        }
        return Math.max(requestedMb, Math.max(0, settings.getMemoryFloorMb()));
    }

    private ObjectNode buildWorkerRequest(SandboxRequest request, Path workdir, long timeoutMs, int memoryLimitMb) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("code", request.code());
        root.put("workdir", workdir.toString());
        root.put("persist", request.persist());
        if (request.datasetName() != null) {
            root.put("dataset_name", request.datasetName());
        }
        root.put("timeout_seconds", Math.max(1L, (timeoutMs + 999) / 1000));
        root.put("memory_limit_mb", memoryLimitMb);
        root.put("max_output_chars", maxOutputChars);
        ArrayNode allowed = root.putArray("allowed_imports");
        PythonCodePolicy.ALLOWED_IMPORT_ROOTS.stream().sorted().forEach(allowed::add);
        ArrayNode banned = root.putArray("banned_calls");
        PythonCodePolicy.BANNED_CALLS.stream().sorted().forEach(banned::add);
        ObjectNode datasets = root.putObject("datasets");
        request.datasets().forEach((name, table) -> datasets.set(name, objectMapper.valueToTree(table.toMap())));
        return root;
    }

    private void writeRequest(Process process, byte[] payload) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(payload);
            stdin.flush();
        } catch (IOException ex) {
            // fails when the worker exits early; the poll loop reports that as a crash
            log.debug("failed to write sandbox request, pid={}: {}", process.pid(), ex.getMessage());
        }
    }

    SandboxResult decodeEnvelope(String message, String strayOutput, String stderr) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(message);
        } catch (IOException ex) {
            return SandboxResult.failure(SandboxErrorKind.CRASH, "malformed sandbox result: " + safeMessage(ex),
                    null, strayOutput, stderr);
        }
        String stdout = joinOutput(strayOutput, envelope.path("stdout").asText(""));
        String capturedStderr = joinOutput(envelope.path("stderr").asText(""), stderr);
        if (!envelope.path("success").asBoolean(false)) {
            String errorType = envelope.path("error_type").asText("");
            SandboxErrorKind kind = "PolicyViolation".equals(errorType) ? SandboxErrorKind.POLICY : SandboxErrorKind.CODE;
            String error = envelope.path("error").asText("unknown error");
            if ("MemoryError".equals(errorType)) {
                error = "memory limit exceeded: " + error;
            }
            return SandboxResult.failure(kind, error, envelope.path("traceback").asText(""), stdout, capturedStderr);
        }

        Map<String, DataTable> datasets = new LinkedHashMap<>();
        envelope.path("datasets").fields().forEachRemaining(entry -> datasets.put(entry.getKey(), DataTable.fromJson(entry.getValue())));

        List<SandboxFigure> figures = new ArrayList<>();
        for (JsonNode figure : envelope.path("figures")) {
            String library = figure.path("library").asText("");
            String title = figure.path("title").asText("");
            if (figure.hasNonNull("json")) {
                figures.add(SandboxFigure.interchange(library, title, figure.get("json").asText()));
            } else {
                figures.add(SandboxFigure.rendered(library, title,
                        figure.path("svg").asText(null), figure.path("png").asText(null)));
            }
        }
        return SandboxResult.success(stdout, capturedStderr, decodeResult(envelope.get("result")), datasets, figures);
    }

    private ResultValue decodeResult(JsonNode node) {
        if (node == null || node.isNull() || !node.isObject()) {
            return null;
        }
        return switch (node.path("type").asText("")) {
            case "scalar" -> new ResultValue.Scalar(objectMapper.convertValue(node.get("value"), Object.class));
            case "table" -> new ResultValue.Table(DataTable.fromJson(node));
            default -> new ResultValue.Opaque(node.path("type_name").asText("object"), node.path("repr").asText(""));
        };
    }

    private Path workerScript() throws IOException {
        Path script = workerScript;
        if (script != null && Files.isRegularFile(script)) {
            return script;
        }
        synchronized (workerScriptLock) {
            if (workerScript != null && Files.isRegularFile(workerScript)) {
                return workerScript;
            }
            try (InputStream input = PythonSandboxExecutor.class.getClassLoader().getResourceAsStream(WORKER_RESOURCE)) {
                if (input == null) {
                    throw new IOException("Missing classpath resource: " + WORKER_RESOURCE);
                }
                Path extracted = Files.createTempFile("python_sandbox_worker", ".py");
                Files.copy(input, extracted, StandardCopyOption.REPLACE_EXISTING);
                extracted.toFile().deleteOnExit();
                workerScript = extracted;
                return extracted;
            }
        }
    }

    private void terminate(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(1, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private void joinQuietly(Thread thread) {
        try {
            thread.join(500);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static String joinOutput(String first, String second) {
        if (first == null || first.isEmpty()) {
            return second == null ? "" : second;
        }
        if (second == null || second.isEmpty()) {
            return first;
        }
        return first + second;
    }

    private static String tail(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= 500 ? trimmed : trimmed.substring(trimmed.length() - 500);
    }

    static String safeSegment(String text) {
        if (text == null || text.isBlank()) {
            return "default";
        }
        return text.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    private static String safeMessage(Exception ex) {
        return ex.getMessage() == null || ex.getMessage().isBlank() ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    // marker lines are results; anything else, such as C extensions writing to the fd directly, stays plain output
    private static final class EnvelopeReader implements Runnable {

        private final InputStream stream;
        private final int maxChars;
        private final BlockingQueue<String> envelopes = new LinkedBlockingQueue<>();
        private final StringBuilder stray = new StringBuilder();

        private EnvelopeReader(InputStream stream, int maxChars) {
            this.stream = stream;
            this.maxChars = maxChars;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.startsWith(RESULT_MARKER)) {
                        envelopes.offer(line.substring(RESULT_MARKER.length()));
                    } else {
                        appendStray(line);
                    }
                }
            } catch (IOException ex) {
                log.debug("python sandbox stdout closed: {}", ex.getMessage());
            }
        }

        private BlockingQueue<String> envelopes() {
            return envelopes;
        }

        private synchronized void appendStray(String line) {
            if (stray.length() < maxChars) {
                stray.append(line).append('\n');
            }
        }

        private synchronized String strayOutput() {
            return OutputLimiter.truncate(stray.toString(), maxChars);
        }
    }
}
