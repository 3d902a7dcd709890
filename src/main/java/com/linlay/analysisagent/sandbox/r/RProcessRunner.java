package com.linlay.analysisagent.sandbox.r;

import com.linlay.analysisagent.sandbox.OutputLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

class RProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(RProcessRunner.class);

    private final String command;
    private final Path libsDir;
    private final int maxOutputChars;

    RProcessRunner(String command, Path libsDir, int maxOutputChars) {
        this.command = command;
        this.libsDir = libsDir.toAbsolutePath().normalize();
        this.maxOutputChars = maxOutputChars;
    }

    String command() {
        return command;
    }

    Path libsDir() {
        return libsDir;
    }

    // maxMemoryMb > 0 caps the address space with ulimit -v before exec
    Outcome run(List<String> arguments, Path workdir, long timeoutMs, int maxMemoryMb) throws IOException {
        Files.createDirectories(libsDir);
        List<String> commandLine = buildCommandLine(arguments, maxMemoryMb);
        ProcessBuilder builder = new ProcessBuilder(commandLine);
        if (workdir != null) {
            builder.directory(workdir.toFile());
        }
        builder.environment().put("R_PROFILE_USER", "");
        builder.environment().put("R_ENVIRON_USER", "");
        builder.environment().put("R_LIBS_USER", libsDir.toString());

        Process process = builder.start();
        OutputLimiter stdout = new OutputLimiter(process.getInputStream(), maxOutputChars);
        OutputLimiter stderr = new OutputLimiter(process.getErrorStream(), maxOutputChars);
        Thread stdoutThread = OutputLimiter.start(stdout, "rscript-stdout");
        Thread stderrThread = OutputLimiter.start(stderr, "rscript-stderr");
        process.getOutputStream().close();

        boolean timedOut = false;
        int exitCode = -1;
        try {
            if (process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                exitCode = process.exitValue();
            } else {
                timedOut = true;
                kill(process);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            timedOut = true;
            kill(process);
        }
        joinQuietly(stdoutThread);
        joinQuietly(stderrThread);
        log.debug("rscript finished, exitCode={}, timedOut={}", exitCode, timedOut);
        return new Outcome(exitCode, timedOut, stdout.text().strip(), stderr.text().strip());
    }

    List<String> buildCommandLine(List<String> arguments, int maxMemoryMb) {
        List<String> commandLine = new ArrayList<>();
        if (maxMemoryMb > 0 && !isWindows()) {
            long kilobytes = Math.max(256L, maxMemoryMb) * 1024L;
            commandLine.add("sh");
            commandLine.add("-c");
            // carry on when ulimit fails, same as platforms without a limit
            commandLine.add("ulimit -v " + kilobytes + " 2>/dev/null; exec \"$0\" \"$@\"");
        }
        commandLine.add(command);
        commandLine.addAll(arguments);
        return commandLine;
    }

    private void kill(Process process) {
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

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }

    record Outcome(int exitCode, boolean timedOut, String stdout, String stderr) {

        boolean succeeded() {
            return !timedOut && exitCode == 0;
        }
    }
}
