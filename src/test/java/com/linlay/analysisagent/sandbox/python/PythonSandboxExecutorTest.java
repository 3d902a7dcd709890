package com.linlay.analysisagent.sandbox.python;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.config.SandboxProperties;
import com.linlay.analysisagent.sandbox.DataTable;
import com.linlay.analysisagent.sandbox.ResultValue;
import com.linlay.analysisagent.sandbox.SandboxErrorKind;
import com.linlay.analysisagent.sandbox.SandboxRequest;
import com.linlay.analysisagent.sandbox.SandboxResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PythonSandboxExecutorTest {

    private static boolean pythonAvailable;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void detectPython() {
        try {
            Process process = new ProcessBuilder("python3", "--version").redirectErrorStream(true).start();
            pythonAvailable = process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException ex) {
            pythonAvailable = false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            pythonAvailable = false;
        }
    }

    @Test
    void shouldReturnStdoutAndScalarResult() {
        assumeTrue(pythonAvailable, "python3 not available");
        PythonSandboxExecutor executor = executor(settings());

        SandboxResult result = executor.execute(SandboxRequest.of("s1", "import math\nprint('hi')\nresult = math.sqrt(16)", Map.of()));

        assertThat(result.success()).isTrue();
        assertThat(result.stdout()).isEqualTo("hi\n");
        assertThat(result.result()).isInstanceOf(ResultValue.Scalar.class);
        assertThat(((ResultValue.Scalar) result.result()).value()).isEqualTo(4.0);
    }

    @Test
    void shouldPersistDatasetChangesOnlyWhenRequested() {
        assumeTrue(pythonAvailable, "python3 not available");
        PythonSandboxExecutor executor = executor(settings());
        DataTable sales = DataTable.of(List.of("k", "v"), rows(List.of("a", 1), List.of("b", 2)));
        String code = "df = df[:1]\nresult = len(df)";

        SandboxResult persisted = executor.execute(
                SandboxRequest.of("s2", code, Map.of("sales", sales)).withDataset("sales", true));
        SandboxResult transient_ = executor.execute(
                SandboxRequest.of("s2", code, Map.of("sales", sales)).withDataset("sales", false));

        assertThat(persisted.success()).isTrue();
        assertThat(persisted.updatedDatasets()).containsKey("sales");
        assertThat(persisted.updatedDatasets().get("sales").rowCount()).isEqualTo(1);
        assertThat(transient_.success()).isTrue();
        assertThat(transient_.updatedDatasets()).isEmpty();
        assertThat(sales.rowCount()).isEqualTo(2);
    }

    @Test
    void shouldReportCodeErrorsWithTraceback() {
        assumeTrue(pythonAvailable, "python3 not available");
        PythonSandboxExecutor executor = executor(settings());

        SandboxResult result = executor.execute(SandboxRequest.of("s3", "print('before')\n1/0", Map.of()));

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(SandboxErrorKind.CODE);
        assertThat(result.error()).contains("ZeroDivisionError");
        assertThat(result.traceback()).contains("ZeroDivisionError");
        assertThat(result.stdout()).contains("before");
    }

    @Test
    void shouldFailMissingDatasetInsideWorker() {
        assumeTrue(pythonAvailable, "python3 not available");
        PythonSandboxExecutor executor = executor(settings());

        SandboxResult result = executor.execute(
                SandboxRequest.of("s4", "result = 1", Map.of()).withDataset("ghost", false));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("dataset 'ghost' does not exist");
    }

    @Test
    void shouldTerminateRunawayCodeAtTimeout() {
        assumeTrue(pythonAvailable, "python3 not available");
        SandboxProperties.Python settings = settings();
        settings.setTimeoutMs(1500);
        PythonSandboxExecutor executor = executor(settings);
        long before = liveChildren();

        long start = System.nanoTime();
        SandboxResult result = executor.execute(SandboxRequest.of("s5", "import time\ntime.sleep(30)", Map.of()));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(SandboxErrorKind.TIMEOUT);
        assertThat(result.error()).isEqualTo("code execution timed out after 1 seconds");
        assertThat(elapsedMs).isLessThan(10_000L);
        assertThat(liveChildren()).isLessThanOrEqualTo(before);
    }

    @Test
    void shouldKillProcessesSpawnedByWorkerOnTimeout() throws Exception {
        assumeTrue(posixShellAvailable(), "POSIX shell required");
        SandboxProperties.Python settings = settings();
        settings.setTimeoutMs(1500);
        settings.setCommand(fakeInterpreter("sleep 300 &\necho $! > child.pid\nwait\n"));
        PythonSandboxExecutor executor = executor(settings);

        SandboxResult result = executor.execute(SandboxRequest.of("s9", "result = 1", Map.of()));

        assertThat(result.errorKind()).isEqualTo(SandboxErrorKind.TIMEOUT);
        Path pidFile = tempDir.resolve("sessions").resolve("s9").resolve("sandbox_tmp").resolve("child.pid");
        assertThat(pidFile).exists();
        long childPid = Long.parseLong(Files.readString(pidFile).strip());
        assertThat(waitUntilGone(childPid, 5_000L)).isTrue();
    }

    @Test
    void shouldTimeOutWhenWorkerNeverReadsItsRequest() throws Exception {
        assumeTrue(posixShellAvailable(), "POSIX shell required");
        SandboxProperties.Python settings = settings();
        settings.setTimeoutMs(1500);
        settings.setCommand(fakeInterpreter("exec sleep 60\n"));
        PythonSandboxExecutor executor = executor(settings);
        String bulkyCode = "result = 1\n" + "# padding\n".repeat(40_000);

        long start = System.nanoTime();
        SandboxResult result = executor.execute(SandboxRequest.of("s10", bulkyCode, Map.of()));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result.errorKind()).isEqualTo(SandboxErrorKind.TIMEOUT);
        assertThat(elapsedMs).isLessThan(10_000L);
    }

    @Test
    void shouldReportMemoryLimitAsFailure() {
        assumeTrue(pythonAvailable, "python3 not available");
        SandboxProperties.Python settings = settings();
        settings.setMemoryFloorMb(0);
        settings.setMaxMemoryMb(256);
        PythonSandboxExecutor executor = executor(settings);

        SandboxResult result = executor.execute(SandboxRequest.of("s6", "block = bytearray(1024 * 1024 * 1024)", Map.of()));

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isIn(SandboxErrorKind.CODE, SandboxErrorKind.CRASH);
        if (result.errorKind() == SandboxErrorKind.CODE) {
            assertThat(result.error()).contains("memory limit exceeded");
        }
    }

    @Test
    void shouldRejectForbiddenImportBeforeStartingWorker() {
        SandboxProperties.Python settings = settings();
        settings.setCommand("definitely-not-a-python-binary");
        PythonSandboxExecutor executor = executor(settings);

        SandboxResult result = executor.execute(SandboxRequest.of("s7", "import os\nos.listdir('.')", Map.of()));

        assertThat(result.errorKind()).isEqualTo(SandboxErrorKind.POLICY);
        assertThat(result.error()).contains("import of 'os' is not allowed");
    }

    @Test
    void shouldReportMissingInterpreterAsConfigurationError() {
        SandboxProperties.Python settings = settings();
        settings.setCommand("definitely-not-a-python-binary");
        PythonSandboxExecutor executor = executor(settings);

        SandboxResult result = executor.execute(SandboxRequest.of("s8", "result = 1", Map.of()));

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(SandboxErrorKind.CONFIGURATION);
        assertThat(result.error()).contains("python interpreter not available");
    }

    @Test
    void shouldApplyMemoryFloorOnlyToPositiveLimits() {
        SandboxProperties.Python settings = settings();
        settings.setMemoryFloorMb(1024);
        PythonSandboxExecutor executor = executor(settings);

        assertThat(executor.resolveMemoryLimit(0)).isZero();
        assertThat(executor.resolveMemoryLimit(128)).isEqualTo(1024);
        assertThat(executor.resolveMemoryLimit(4096)).isEqualTo(4096);
    }

    @Test
    void shouldDecodeFailureEnvelopeKinds() {
        PythonSandboxExecutor executor = executor(settings());

        SandboxResult policy = executor.decodeEnvelope(
                "{\"success\":false,\"error_type\":\"PolicyViolation\",\"error\":\"PolicyViolation: import of 'os' is not allowed\"}",
                "", "");
        SandboxResult memory = executor.decodeEnvelope(
                "{\"success\":false,\"error_type\":\"MemoryError\",\"error\":\"MemoryError\"}", "stray\n", "");
        SandboxResult malformed = executor.decodeEnvelope("{oops", "", "");

        assertThat(policy.errorKind()).isEqualTo(SandboxErrorKind.POLICY);
        assertThat(memory.error()).isEqualTo("memory limit exceeded: MemoryError");
        assertThat(memory.stdout()).isEqualTo("stray\n");
        assertThat(malformed.errorKind()).isEqualTo(SandboxErrorKind.CRASH);
    }

    private String fakeInterpreter(String body) throws IOException {
        Path script = tempDir.resolve("fake-python.sh");
        Files.writeString(script, "#!/bin/sh\n" + body);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));
        return script.toString();
    }

    private static boolean posixShellAvailable() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix")
                && Files.isExecutable(Path.of("/bin/sh"));
    }

    private static boolean waitUntilGone(long pid, long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (System.nanoTime() < deadline) {
            if (ProcessHandle.of(pid).map(handle -> !handle.isAlive()).orElse(true) || isZombie(pid)) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }

    // a killed orphan stays as a zombie until its new parent reaps it
    private static boolean isZombie(long pid) {
        Path stat = Path.of("/proc", Long.toString(pid), "stat");
        try {
            String content = Files.readString(stat);
            int close = content.lastIndexOf(')');
            return close > 0 && close + 2 < content.length() && content.charAt(close + 2) == 'Z';
        } catch (IOException ex) {
            return false;
        }
    }

    private PythonSandboxExecutor executor(SandboxProperties.Python settings) {
        return new PythonSandboxExecutor(new ObjectMapper(), settings, 20_000, tempDir.resolve("sessions"));
    }

    private static SandboxProperties.Python settings() {
        SandboxProperties.Python settings = new SandboxProperties.Python();
        settings.setTimeoutMs(20_000);
        settings.setMaxMemoryMb(0);
        return settings;
    }

    private static long liveChildren() {
        return ProcessHandle.current().children().filter(ProcessHandle::isAlive).count();
    }

    private static List<List<Object>> rows(List<?>... rows) {
        List<List<Object>> result = new ArrayList<>();
        Arrays.stream(rows).forEach(row -> result.add(new ArrayList<>(row)));
        return result;
    }
}
