package com.linlay.analysisagent.sandbox.r;

public record RInstallation(boolean available, String command, String version, String message) {

    static RInstallation missing(String command, String message) {
        return new RInstallation(false, command, null, message);
    }
}
