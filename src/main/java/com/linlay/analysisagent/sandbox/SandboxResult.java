package com.linlay.analysisagent.sandbox;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SandboxResult(
        boolean success,
        String stdout,
        String stderr,
        ResultValue result,
        Map<String, DataTable> updatedDatasets,
        List<SandboxFigure> figures,
        String error,
        String traceback,
        SandboxErrorKind errorKind
) {

    public SandboxResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        updatedDatasets = updatedDatasets == null || updatedDatasets.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(updatedDatasets));
        figures = figures == null ? List.of() : List.copyOf(figures);
        traceback = traceback == null ? "" : traceback;
    }

    public static SandboxResult success(
            String stdout,
            String stderr,
            ResultValue result,
            Map<String, DataTable> updatedDatasets,
            List<SandboxFigure> figures
    ) {
        return new SandboxResult(true, stdout, stderr, result, updatedDatasets, figures, null, null, null);
    }

    public static SandboxResult failure(SandboxErrorKind kind, String error) {
        return new SandboxResult(false, "", "", null, Map.of(), List.of(), error, null, kind);
    }

    public static SandboxResult failure(SandboxErrorKind kind, String error, String traceback, String stdout, String stderr) {
        return new SandboxResult(false, stdout, stderr, null, Map.of(), List.of(), error, traceback, kind);
    }

    public boolean timedOut() {
        return errorKind == SandboxErrorKind.TIMEOUT;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", success);
        map.put("stdout", stdout);
        map.put("stderr", stderr);
        if (result != null) {
            map.put("result", result.toMap());
        }
        if (!updatedDatasets.isEmpty()) {
            Map<String, Object> datasets = new LinkedHashMap<>();
            updatedDatasets.forEach((name, table) -> datasets.put(name, Map.of(
                    "rows", table.rowCount(),
                    "columns", table.columns()
            )));
            map.put("datasets", datasets);
        }
        if (!figures.isEmpty()) {
            map.put("figure_count", figures.size());
        }
        if (!success) {
            map.put("error", error == null ? "unknown sandbox error" : error);
            map.put("error_kind", errorKind == null ? SandboxErrorKind.CODE.name() : errorKind.name());
            if (!traceback.isEmpty()) {
                map.put("traceback", traceback);
            }
        }
        return map;
    }
}
