package com.linlay.analysisagent.sandbox;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// datasets are deep-copied on construction; null limits fall back to executor settings
public record SandboxRequest(
        String sessionId,
        String code,
        Map<String, DataTable> datasets,
        String datasetName,
        boolean persist,
        Long timeoutMs,
        Integer maxMemoryMb
) {

    public SandboxRequest {
        sessionId = sessionId == null || sessionId.isBlank() ? "default" : sessionId.trim();
        code = code == null ? "" : code;
        datasets = copyDatasets(datasets);
        datasetName = datasetName == null || datasetName.isBlank() ? null : datasetName.trim();
    }

    public static SandboxRequest of(String sessionId, String code, Map<String, DataTable> datasets) {
        return new SandboxRequest(sessionId, code, datasets, null, false, null, null);
    }

    public SandboxRequest withDataset(String name, boolean persistChanges) {
        return new SandboxRequest(sessionId, code, datasets, name, persistChanges, timeoutMs, maxMemoryMb);
    }

    public SandboxRequest withLimits(Long timeout, Integer maxMemory) {
        return new SandboxRequest(sessionId, code, datasets, datasetName, persist, timeout, maxMemory);
    }

    private static Map<String, DataTable> copyDatasets(Map<String, DataTable> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, DataTable> copied = new LinkedHashMap<>();
        source.forEach((name, table) -> {
            if (name != null && table != null) {
                copied.put(name, table.copy());
            }
        });
        return Collections.unmodifiableMap(copied);
    }
}
