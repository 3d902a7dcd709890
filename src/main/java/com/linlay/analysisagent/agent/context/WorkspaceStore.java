package com.linlay.analysisagent.agent.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.config.RunnerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Per-session workspace under {@code <sessions-dir>/<sessionId>/workspace}.
 */
@Component
public class WorkspaceStore {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceStore.class);

    static final String ARTIFACTS_DIR = "artifacts";
    static final String NOTES_DIR = "notes";
    static final String REPORTS_DIR = "reports";
    static final String EXECUTION_LOG = "executions.jsonl";

    private final Path sessionsDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public WorkspaceStore(RunnerProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getSessionsDir()), objectMapper);
    }

    public WorkspaceStore(Path sessionsDir, ObjectMapper objectMapper) {
        this.sessionsDir = sessionsDir.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    public Path sessionDir(String sessionId) {
        return sessionsDir.resolve(safeSegment(sessionId));
    }

    public Path workspaceDir(String sessionId) {
        return sessionDir(sessionId).resolve("workspace");
    }

    public Path archiveDir(String sessionId) {
        return sessionDir(sessionId).resolve("archive");
    }

    public Map<String, Object> saveTextArtifact(String sessionId, String filename, String content, String type) {
        return saveArtifact(sessionId, filename, (content == null ? "" : content).getBytes(StandardCharsets.UTF_8), type);
    }

    public Map<String, Object> saveArtifact(String sessionId, String filename, byte[] bytes, String type) {
        Path target = uniqueTarget(workspaceDir(sessionId).resolve(ARTIFACTS_DIR), safeFileName(filename));
        write(target, bytes);
        log.debug("Saved artifact: session={}, path={}", sessionId, target);
        return describe(target, type, bytes.length);
    }

    // files outside the workspace are copied in before registration
    public Map<String, Object> registerFile(String sessionId, Path source, String type) {
        Path workspace = workspaceDir(sessionId);
        Path normalized = source.toAbsolutePath().normalize();
        Path target = normalized;
        try {
            if (!normalized.startsWith(workspace)) {
                target = uniqueTarget(workspace.resolve(ARTIFACTS_DIR), safeFileName(normalized.getFileName().toString()));
                Files.createDirectories(target.getParent());
                Files.copy(normalized, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return describe(target, type, Files.size(target));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to register artifact: " + source, ex);
        }
    }

    public Path saveNote(String sessionId, String filename, String text) {
        Path target = uniqueTarget(workspaceDir(sessionId).resolve(NOTES_DIR), safeFileName(filename));
        write(target, (text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
        return target;
    }

    public Map<String, Object> saveReport(String sessionId, String filename, String markdown) {
        byte[] bytes = (markdown == null ? "" : markdown).getBytes(StandardCharsets.UTF_8);
        Path target = uniqueTarget(workspaceDir(sessionId).resolve(REPORTS_DIR), safeFileName(filename));
        write(target, bytes);
        return describe(target, "report", bytes.length);
    }

    public void appendExecutionLog(String sessionId, Map<String, Object> entry) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("timestamp", Instant.now().toString());
        if (entry != null) {
            record.putAll(entry);
        }
        Path target = workspaceDir(sessionId).resolve(EXECUTION_LOG);
        try {
            Files.createDirectories(target.getParent());
            String line = objectMapper.writeValueAsString(record) + "\n";
            Files.writeString(target, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Execution log entry is not serializable", ex);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to append execution log: " + target, ex);
        }
    }

    public List<Map<String, Object>> listArtifacts(String sessionId) {
        Path dir = workspaceDir(sessionId).resolve(ARTIFACTS_DIR);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Map<String, Object>> artifacts = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(Files::isRegularFile)
                    .sorted()
                    .forEach(file -> artifacts.add(describe(file, typeOf(file), sizeOf(file))));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list artifacts: " + dir, ex);
        }
        return artifacts;
    }

    public static String safeSegment(String raw) {
        String value = raw == null ? "" : raw.trim();
        String cleaned = value.replaceAll("[^A-Za-z0-9._-]", "_");
        if (cleaned.isBlank() || cleaned.chars().allMatch(ch -> ch == '.')) {
            return "default";
        }
        return cleaned;
    }

    public static String safeFileName(String raw) {
        String value = raw == null ? "" : raw.trim();
        // keep non-ASCII names, strip only path separators and control characters
        String cleaned = value.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_").replaceAll("\\s+", "_");
        while (cleaned.startsWith(".")) {
            cleaned = cleaned.substring(1);
        }
        if (cleaned.isBlank()) {
            return "artifact";
        }
        return cleaned.length() > 120 ? cleaned.substring(cleaned.length() - 120) : cleaned;
    }

    private Map<String, Object> describe(Path file, String type, long size) {
        String name = file.getFileName().toString();
        Map<String, Object> artifact = new LinkedHashMap<>();
        artifact.put("name", name);
        artifact.put("type", type == null || type.isBlank() ? typeOf(file) : type);
        artifact.put("format", extension(name));
        artifact.put("path", file.toString());
        artifact.put("size_bytes", size);
        return artifact;
    }

    private Path uniqueTarget(Path dir, String filename) {
        Path candidate = dir.resolve(filename);
        if (!Files.exists(candidate)) {
            return candidate;
        }
        String ext = extension(filename);
        String stem = ext.isEmpty() ? filename : filename.substring(0, filename.length() - ext.length() - 1);
        for (int i = 1; ; i++) {
            candidate = dir.resolve(stem + "_" + i + (ext.isEmpty() ? "" : "." + ext));
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
    }

    private void write(Path target, byte[] bytes) {
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, bytes);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write workspace file: " + target, ex);
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read file size: " + file, ex);
        }
    }

    static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot <= 0 || dot == filename.length() - 1 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static String typeOf(Path file) {
        return switch (extension(file.getFileName().toString())) {
            case "png", "svg", "jpg", "jpeg", "pdf", "html" -> "chart";
            case "py", "r" -> "code";
            case "md" -> "report";
            case "csv", "xlsx", "json" -> "data";
            default -> "file";
        };
    }
}
