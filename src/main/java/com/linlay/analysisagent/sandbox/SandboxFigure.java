package com.linlay.analysisagent.sandbox;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

public record SandboxFigure(
        String library,
        String title,
        String format,
        String json,
        String svg,
        String pngBase64,
        Path path,
        long sizeBytes
) {

    public SandboxFigure {
        library = library == null ? "" : library;
        title = title == null ? "" : title;
        format = format == null ? "" : format;
    }

    public static SandboxFigure interchange(String library, String title, String json) {
        return new SandboxFigure(library, title, "json", json, null, null, null, 0L);
    }

    public static SandboxFigure rendered(String library, String title, String svg, String pngBase64) {
        return new SandboxFigure(library, title, "svg+png", null, svg, pngBase64, null, 0L);
    }

    public static SandboxFigure file(String library, String title, String format, Path path, long sizeBytes) {
        return new SandboxFigure(library, title, format, null, null, null, path, sizeBytes);
    }

    public boolean isFile() {
        return path != null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("library", library);
        map.put("title", title);
        map.put("format", format);
        if (json != null) {
            map.put("json", json);
        }
        if (svg != null) {
            map.put("svg", svg);
        }
        if (pngBase64 != null) {
            map.put("png_base64", pngBase64);
        }
        if (path != null) {
            map.put("path", path.toString());
            map.put("filename", path.getFileName() == null ? "" : path.getFileName().toString());
            map.put("size_bytes", sizeBytes);
        }
        return map;
    }
}
