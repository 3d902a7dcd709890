package com.linlay.analysisagent.agent.context;

import java.nio.file.Path;

public record CompressionResult(
        boolean success,
        String message,
        int archivedCount,
        int remainingCount,
        String summary,
        Path archivePath
) {

    public static CompressionResult skipped(String message, int remainingCount) {
        return new CompressionResult(false, message, 0, remainingCount, "", null);
    }
}
