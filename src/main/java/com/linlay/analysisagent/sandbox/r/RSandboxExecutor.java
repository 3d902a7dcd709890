package com.linlay.analysisagent.sandbox.r;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.analysisagent.config.RunnerProperties;
import com.linlay.analysisagent.config.SandboxProperties;
import com.linlay.analysisagent.sandbox.CodeSandbox;
import com.linlay.analysisagent.sandbox.DataTable;
import com.linlay.analysisagent.sandbox.ResultValue;
import com.linlay.analysisagent.sandbox.SandboxErrorKind;
import com.linlay.analysisagent.sandbox.SandboxFigure;
import com.linlay.analysisagent.sandbox.SandboxRequest;
import com.linlay.analysisagent.sandbox.SandboxResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

@Component
public class RSandboxExecutor implements CodeSandbox {

    private static final Logger log = LoggerFactory.getLogger(RSandboxExecutor.class);

    private static final Set<String> PLOT_EXTENSIONS = Set.of("pdf", "png", "svg", "html");
    private static final long DETECT_TIMEOUT_MS = 10_000L;

    private final ObjectMapper objectMapper;
    private final SandboxProperties.R settings;
    private final Path sessionsDir;
    private final RProcessRunner runner;
    private final RPackageManager packageManager;
    private final AtomicReference<RInstallation> installation = new AtomicReference<>();

    @Autowired
    public RSandboxExecutor(ObjectMapper objectMapper, SandboxProperties properties, RunnerProperties runnerProperties) {
        this(objectMapper, properties.getR(), properties.getMaxOutputChars(), Path.of(runnerProperties.getSessionsDir()));
    }

    RSandboxExecutor(ObjectMapper objectMapper, SandboxProperties.R settings, int maxOutputChars, Path sessionsDir) {
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.sessionsDir = sessionsDir.toAbsolutePath().normalize();
        this.runner = new RProcessRunner(settings.getCommand(), Path.of(settings.getLibsDir()), maxOutputChars);
        this.packageManager = new RPackageManager(runner, settings.getCranMirror(),
                Math.max(10_000L, settings.getTimeoutMs() / 2), settings.getInstallTimeoutMs());
    }

    @Override
    public String language() {
        return "r";
    }

    // cached; refreshInstallation() forces a new probe
    public RInstallation detectInstallation() {
        RInstallation cached = installation.get();
        if (cached != null) {
            return cached;
        }
        RInstallation detected = probe();
        installation.compareAndSet(null, detected);
        return installation.get();
    }

    public void refreshInstallation() {
        installation.set(null);
    }

    @Override
    public SandboxResult execute(SandboxRequest request) {
        if (!settings.isEnabled()) {
            return SandboxResult.failure(SandboxErrorKind.CONFIGURATION, "R sandbox is disabled");
        }
        Optional<String> violation = RCodePolicy.check(request.code());
        if (violation.isPresent()) {
            log.info("R sandbox rejected code, session={}, reason={}", request.sessionId(), violation.get());
            return SandboxResult.failure(SandboxErrorKind.POLICY, "code rejected by sandbox policy: " + violation.get());
        }
        RInstallation detected = detectInstallation();
        if (!detected.available()) {
            return SandboxResult.failure(SandboxErrorKind.CONFIGURATION, detected.message());
        }

        Path sessionDir = sessionsDir.resolve(safeSegment(request.sessionId()));
        String runId = "run_" + (System.currentTimeMillis() / 1000) + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        Path runDir = sessionDir.resolve("r_sandbox_tmp").resolve(runId);
        long startNanos = System.nanoTime();
        try {
            Files.createDirectories(runDir);
            SandboxResult packageFailure = ensurePackages(request.code());
            if (packageFailure != null) {
                return packageFailure;
            }

            Path manifestPath = writeDatasets(request.datasets(), runDir);
            Path userCodePath = runDir.resolve("user_code.R");
            Files.writeString(userCodePath, request.code(), StandardCharsets.UTF_8);
            Path wrapperPath = runDir.resolve("_wrapper.R");
            Files.writeString(wrapperPath,
                    RWrapperScript.build(userCodePath, manifestPath, request.datasetName(), request.persist()),
                    StandardCharsets.UTF_8);

            long timeoutMs = request.timeoutMs() == null || request.timeoutMs() <= 0 ? settings.getTimeoutMs() : request.timeoutMs();
            int maxMemoryMb = request.maxMemoryMb() == null ? settings.getMaxMemoryMb() : request.maxMemoryMb();
            RProcessRunner.Outcome outcome = runner.run(List.of("--vanilla", wrapperPath.toString()), runDir, timeoutMs, maxMemoryMb);
            if (outcome.timedOut()) {
                log.info("R sandbox timed out, session={}, timeoutMs={}", request.sessionId(), timeoutMs);
                return SandboxResult.failure(SandboxErrorKind.TIMEOUT,
                        "R code execution timed out after " + Math.max(1, timeoutMs / 1000) + " seconds",
                        null, outcome.stdout(), outcome.stderr());
            }

            SandboxResult result = collectResult(request, runDir, sessionDir, runId, outcome);
            log.info("R sandbox finished, session={}, success={}, elapsedMs={}",
                    request.sessionId(), result.success(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
            return result;
        } catch (IOException ex) {
            log.warn("R sandbox execution failed, session={}", request.sessionId(), ex);
            return SandboxResult.failure(SandboxErrorKind.CRASH, "R code execution failed: " + safeMessage(ex));
        } finally {
            deleteRecursively(runDir);
        }
    }

    private SandboxResult ensurePackages(String code) throws IOException {
        Set<String> packages = new TreeSet<>(RPackageManager.referencedPackages(code));
        packages.addAll(RPackageManager.BOOTSTRAP_PACKAGES);
        Set<String> missing = new TreeSet<>();
        packageManager.checkInstalled(packages).forEach((pkg, installed) -> {
            if (!installed) {
                missing.add(pkg);
            }
        });
        if (missing.isEmpty()) {
            return null;
        }
        if (!settings.isAutoInstall()) {
            return SandboxResult.failure(SandboxErrorKind.CONFIGURATION, "missing R packages: " + String.join(", ", missing));
        }
        RPackageManager.InstallResult install = packageManager.install(missing);
        if (!install.ok()) {
            return SandboxResult.failure(SandboxErrorKind.CONFIGURATION,
                    "automatic R package installation failed: " + String.join(", ", missing), null, "", install.log());
        }
        return null;
    }

    Path writeDatasets(Map<String, DataTable> datasets, Path runDir) throws IOException {
        Path datasetsDir = Files.createDirectories(runDir.resolve("datasets"));
        ArrayNode manifest = objectMapper.createArrayNode();
        int index = 0;
        for (Map.Entry<String, DataTable> entry : datasets.entrySet()) {
            index++;
            Path csvPath = datasetsDir.resolve(String.format(Locale.ROOT, "%03d_%s.csv", index, sanitizeStem(entry.getKey(), index)));
            Files.writeString(csvPath, CsvWriter.write(entry.getValue()), StandardCharsets.UTF_8);
            ObjectNode item = manifest.addObject();
            item.put("name", entry.getKey());
            item.put("path", csvPath.toString());
        }
        Path manifestPath = runDir.resolve("_datasets_manifest.json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(manifestPath.toFile(), manifest);
        return manifestPath;
    }

    private SandboxResult collectResult(SandboxRequest request, Path runDir, Path sessionDir, String runId,
                                        RProcessRunner.Outcome outcome) throws IOException {
        JsonNode envelope = readJson(runDir.resolve(RWrapperScript.RESULT_FILE));
        boolean envelopeSuccess = envelope != null && envelope.path("success").asBoolean(false);
        if (outcome.exitCode() != 0 || !envelopeSuccess) {
            String error;
            if (envelope != null && envelope.hasNonNull("error")) {
                error = envelope.get("error").asText();
            } else if (!outcome.stderr().isBlank()) {
                error = outcome.stderr();
            } else {
                error = "R code execution failed (exit code " + outcome.exitCode() + ")";
            }
            return SandboxResult.failure(SandboxErrorKind.CODE, error, null, outcome.stdout(), outcome.stderr());
        }

        ResultValue result = decodeResult(envelope);
        JsonNode outputDf = readJson(runDir.resolve(RWrapperScript.OUTPUT_DF_FILE));
        if (outputDf != null) {
            result = new ResultValue.Table(DataTable.fromJson(outputDf));
        }

        Map<String, DataTable> updated = new LinkedHashMap<>();
        if (request.persist()) {
            JsonNode updates = readJson(runDir.resolve(RWrapperScript.DATASETS_FILE));
            if (updates != null && updates.isObject()) {
                updates.fields().forEachRemaining(entry -> updated.put(entry.getKey(), DataTable.fromJson(entry.getValue())));
            }
        }

        List<SandboxFigure> figures = collectPlots(runDir.resolve(RWrapperScript.PLOTS_DIR),
                sessionDir.resolve("workspace").resolve("plots"), runId);
        return SandboxResult.success(outcome.stdout(), outcome.stderr(), result, updated, figures);
    }

    private ResultValue decodeResult(JsonNode envelope) {
        String type = envelope.path("result_type").asText("null");
        return switch (type) {
            case "table" -> new ResultValue.Table(DataTable.fromJson(envelope.get("result")));
            case "scalar" -> new ResultValue.Scalar(objectMapper.convertValue(envelope.get("result"), Object.class));
            case "opaque" -> new ResultValue.Opaque(envelope.path("type_name").asText("object"),
                    envelope.path("result_repr").asText(""));
            default -> null;
        };
    }

    // the run dir is deleted afterwards, so plots are copied to the workspace first
    private List<SandboxFigure> collectPlots(Path plotsDir, Path targetDir, String runId) throws IOException {
        List<SandboxFigure> figures = new ArrayList<>();
        if (!Files.isDirectory(plotsDir)) {
            return figures;
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(plotsDir)) {
            files = stream.filter(Files::isRegularFile).sorted().toList();
        }
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            String extension = dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
            if (!PLOT_EXTENSIONS.contains(extension) || Files.size(file) == 0) {
                continue;
            }
            Files.createDirectories(targetDir);
            Path target = targetDir.resolve(runId + "_" + fileName);
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
            figures.add(SandboxFigure.file("r", fileName.substring(0, dot), extension, target, Files.size(target)));
        }
        return figures;
    }

    private JsonNode readJson(Path path) {
        if (!Files.isRegularFile(path)) {
            return null;
        }
        try {
            return objectMapper.readTree(path.toFile());
        } catch (IOException ex) {
            log.warn("unreadable R sandbox output {}: {}", path.getFileName(), ex.getMessage());
            return null;
        }
    }

    private RInstallation probe() {
        try {
            RProcessRunner.Outcome outcome = runner.run(List.of("--version"), null, DETECT_TIMEOUT_MS, 0);
            String version = outcome.stdout().isBlank() ? outcome.stderr() : outcome.stdout();
            if (outcome.succeeded()) {
                return new RInstallation(true, runner.command(), version, "Rscript available");
            }
            return RInstallation.missing(runner.command(), "Rscript check failed: " + version);
        } catch (IOException ex) {
            log.info("Rscript not found, command={}: {}", runner.command(), ex.getMessage());
            return RInstallation.missing(runner.command(), "Rscript not found (" + runner.command() + ")");
        }
    }

    private void deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException ex) {
                    log.debug("failed to delete {}: {}", path, ex.getMessage());
                }
            });
        } catch (IOException ex) {
            log.debug("failed to clean R run directory {}: {}", root, ex.getMessage());
        }
    }

    static String sanitizeStem(String name, int index) {
        String cleaned = name == null ? "" : name.replaceAll("[^0-9A-Za-z_.-]", "_").replaceAll("^[._]+|[._]+$", "");
        return cleaned.isEmpty() ? "dataset_" + index : cleaned;
    }

    private static String safeSegment(String text) {
        if (text == null || text.isBlank()) {
            return "default";
        }
        return text.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    private static String safeMessage(Exception ex) {
        return ex.getMessage() == null || ex.getMessage().isBlank() ? ex.getClass().getSimpleName() : ex.getMessage();
    }
}
