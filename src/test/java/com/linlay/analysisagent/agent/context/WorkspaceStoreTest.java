package com.linlay.analysisagent.agent.context;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WorkspaceStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldSaveArtifactsWithoutOverwriting() throws Exception {
        WorkspaceStore store = new WorkspaceStore(tempDir.resolve("sessions"), objectMapper);

        Map<String, Object> first = store.saveTextArtifact("s1", "analysis.py", "print(1)", "code");
        Map<String, Object> second = store.saveTextArtifact("s1", "analysis.py", "print(2)", "code");

        assertThat(first.get("name")).isEqualTo("analysis.py");
        assertThat(second.get("name")).isEqualTo("analysis_1.py");
        assertThat(second).containsEntry("type", "code").containsEntry("format", "py").containsEntry("size_bytes", 8L);
        Path secondPath = Path.of((String) second.get("path"));
        assertThat(secondPath.getParent()).isEqualTo(store.workspaceDir("s1").resolve(WorkspaceStore.ARTIFACTS_DIR));
        assertThat(Files.readString(secondPath)).isEqualTo("print(2)");
    }

    @Test
    void shouldListArtifactsSortedWithInferredTypes() {
        WorkspaceStore store = new WorkspaceStore(tempDir, objectMapper);
        store.saveArtifact("s1", "volcano.png", new byte[]{1, 2, 3}, null);
        store.saveTextArtifact("s1", "deg.csv", "gene\nTP53", null);
        store.saveTextArtifact("s1", "notes.txt", "x", null);

        List<Map<String, Object>> artifacts = store.listArtifacts("s1");

        assertThat(artifacts).extracting(item -> item.get("name")).containsExactly("deg.csv", "notes.txt", "volcano.png");
        assertThat(artifacts).extracting(item -> item.get("type")).containsExactly("data", "file", "chart");
        assertThat(store.listArtifacts("empty-session")).isEmpty();
    }

    @Test
    void shouldCopyExternalFilesIntoWorkspace() throws Exception {
        WorkspaceStore store = new WorkspaceStore(tempDir.resolve("sessions"), objectMapper);
        Path external = tempDir.resolve("plot.svg");
        Files.writeString(external, "<svg/>");

        Map<String, Object> registered = store.registerFile("s1", external, null);

        Path copied = Path.of((String) registered.get("path"));
        assertThat(copied).startsWith(store.workspaceDir("s1"));
        assertThat(registered).containsEntry("type", "chart").containsEntry("size_bytes", 6L);
        assertThat(Files.readString(copied)).isEqualTo("<svg/>");
    }

    @Test
    void shouldAppendExecutionLogAsJsonLines() throws Exception {
        WorkspaceStore store = new WorkspaceStore(tempDir, objectMapper);

        store.appendExecutionLog("s1", Map.of("tool", "run_code", "success", true));
        store.appendExecutionLog("s1", Map.of("tool", "run_r_code", "success", false));

        List<String> lines = Files.readAllLines(store.workspaceDir("s1").resolve(WorkspaceStore.EXECUTION_LOG), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(objectMapper.readTree(lines.get(0)).path("tool").asText()).isEqualTo("run_code");
        assertThat(objectMapper.readTree(lines.get(1)).path("success").asBoolean()).isFalse();
        assertThat(objectMapper.readTree(lines.get(1)).has("timestamp")).isTrue();
    }

    @Test
    void shouldSaveReportsAndNotesInSeparateDirectories() {
        WorkspaceStore store = new WorkspaceStore(tempDir, objectMapper);

        Map<String, Object> report = store.saveReport("s1", "report.md", "# Title");
        Path note = store.saveNote("s1", "plan.md", "1. load");

        assertThat(report).containsEntry("type", "report");
        assertThat(Path.of((String) report.get("path")).getParent())
                .isEqualTo(store.workspaceDir("s1").resolve(WorkspaceStore.REPORTS_DIR));
        assertThat(note.getParent()).isEqualTo(store.workspaceDir("s1").resolve(WorkspaceStore.NOTES_DIR));
    }

    @Test
    void shouldSanitizePathSegments() {
        assertThat(WorkspaceStore.safeSegment("..")).isEqualTo("default");
        assertThat(WorkspaceStore.safeSegment(null)).isEqualTo("default");
        assertThat(WorkspaceStore.safeSegment(" a b ")).isEqualTo("a_b");
        assertThat(WorkspaceStore.safeSegment("../etc")).doesNotContain("/");
        assertThat(WorkspaceStore.safeFileName("a/b:c.png")).isEqualTo("a_b_c.png");
        assertThat(WorkspaceStore.safeFileName("火山图 v1.png")).isEqualTo("火山图_v1.png");
        assertThat(WorkspaceStore.safeFileName(".hidden")).isEqualTo("hidden");
        assertThat(WorkspaceStore.safeFileName("  ")).isEqualTo("artifact");
        assertThat(WorkspaceStore.extension("Plot.SVG")).isEqualTo("svg");
        assertThat(WorkspaceStore.extension("README")).isEmpty();
    }
}
