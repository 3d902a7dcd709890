package com.linlay.analysisagent.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "agent.sandbox")
public class SandboxProperties {

    private Python python = new Python();
    private R r = new R();
    @Min(256)
    private int maxOutputChars = 20_000;

    public Python getPython() {
        return python;
    }

    public void setPython(Python python) {
        this.python = python == null ? new Python() : python;
    }

    public R getR() {
        return r;
    }

    public void setR(R r) {
        this.r = r == null ? new R() : r;
    }

    public int getMaxOutputChars() {
        return maxOutputChars;
    }

    public void setMaxOutputChars(int maxOutputChars) {
        this.maxOutputChars = maxOutputChars;
    }

    public static class Python {
        private String command = "python3";
        @Min(1)
        private long timeoutMs = 60_000L;
        private int maxMemoryMb = 2048;
        // positive requests below the floor are raised to it; 0 disables the floor
        private int memoryFloorMb = 1024;
        @Min(1)
        private long pollIntervalMs = 50L;
        @Min(1)
        private long joinTimeoutMs = 1000L;

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxMemoryMb() {
            return maxMemoryMb;
        }

        public void setMaxMemoryMb(int maxMemoryMb) {
            this.maxMemoryMb = maxMemoryMb;
        }

        public int getMemoryFloorMb() {
            return memoryFloorMb;
        }

        public void setMemoryFloorMb(int memoryFloorMb) {
            this.memoryFloorMb = memoryFloorMb;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getJoinTimeoutMs() {
            return joinTimeoutMs;
        }

        public void setJoinTimeoutMs(long joinTimeoutMs) {
            this.joinTimeoutMs = joinTimeoutMs;
        }
    }

    public static class R {
        private String command = "Rscript";
        private boolean enabled = true;
        @Min(1)
        private long timeoutMs = 120_000L;
        @Min(1)
        private long installTimeoutMs = 600_000L;
        private int maxMemoryMb = 2048;
        private boolean autoInstall = true;
        private String libsDir = "data/r_libs";
        private String cranMirror = "https://cloud.r-project.org";

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getInstallTimeoutMs() {
            return installTimeoutMs;
        }

        public void setInstallTimeoutMs(long installTimeoutMs) {
            this.installTimeoutMs = installTimeoutMs;
        }

        public int getMaxMemoryMb() {
            return maxMemoryMb;
        }

        public void setMaxMemoryMb(int maxMemoryMb) {
            this.maxMemoryMb = maxMemoryMb;
        }

        public boolean isAutoInstall() {
            return autoInstall;
        }

        public void setAutoInstall(boolean autoInstall) {
            this.autoInstall = autoInstall;
        }

        public String getLibsDir() {
            return libsDir;
        }

        public void setLibsDir(String libsDir) {
            this.libsDir = libsDir;
        }

        public String getCranMirror() {
            return cranMirror;
        }

        public void setCranMirror(String cranMirror) {
            this.cranMirror = cranMirror;
        }
    }
}
