package com.linlay.analysisagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.agent.Session;
import com.linlay.analysisagent.agent.context.WorkspaceStore;
import com.linlay.analysisagent.sandbox.DataTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GenerateReportToolTest {

    @TempDir
    Path tempDir;

    private WorkspaceStore workspaceStore;
    private GenerateReportTool tool;

    @BeforeEach
    void setUp() {
        workspaceStore = new WorkspaceStore(tempDir, new ObjectMapper());
        tool = new GenerateReportTool(workspaceStore);
    }

    @Test
    void shouldRequireTitle() {
        JsonNode result = tool.invoke(new Session("s1"), Map.of("summary", "x"));

        assertThat(result.path("success").asBoolean()).isFalse();
        assertThat(result.path("error").asText()).isEqualTo("title must not be empty");
    }

    @Test
    void shouldRenderAllSectionsInOrder() {
        Session session = new Session("s1");
        session.putDataset("expr|raw", DataTable.of(List.of("gene", "count"), List.of(List.<Object>of("TP53", 12))));
        workspaceStore.saveArtifact("s1", "volcano.png", new byte[]{1}, "chart");
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("title", "Differential expression");
        args.put("summary", "12 genes changed.");
        args.put("sections", List.of(
                Map.of("heading", "Methods", "content", "  DESeq2 with default settings.  "),
                Map.of("content", "ignored without heading"),
                Map.of("heading", "Results", "content", "")
        ));
        args.put("conclusions", "TP53 is up-regulated.");

        String markdown = tool.render(session, "Differential expression", args);

        assertThat(markdown).isEqualTo("""
                # Differential expression

                ## Summary

                12 genes changed.

                ## Datasets

                | Dataset | Rows | Columns |
                | --- | ---: | ---: |
                | expr\\|raw | 1 | 2 |

                ## Methods

                DESeq2 with default settings.

                ## Results

                ## Artifacts

                - volcano.png (chart)

                ## Conclusions

                TP53 is up-regulated.
                """);
    }

    @Test
    void shouldSkipOptionalBlocksWhenDisabled() {
        Session session = new Session("s1");
        session.putDataset("expr", DataTable.of(List.of("gene"), List.of(List.<Object>of("TP53"))));
        workspaceStore.saveArtifact("s1", "volcano.png", new byte[]{1}, "chart");

        String markdown = tool.render(session, "Quick look", Map.of("include_datasets", false, "include_artifacts", false));

        assertThat(markdown).isEqualTo("# Quick look\n");
    }

    @Test
    void shouldSaveReportToWorkspace() throws Exception {
        JsonNode result = tool.invoke(new Session("s1"), Map.of("title", "Final report", "conclusions", "done"));

        assertThat(result.path("success").asBoolean()).isTrue();
        String markdown = result.path("data").path(GenerateReportTool.REPORT_MARKDOWN).asText();
        assertThat(markdown).isEqualTo("# Final report\n\n## Conclusions\n\ndone\n");
        Path saved = Path.of(result.path("data").path("path").asText());
        assertThat(saved.getFileName().toString()).startsWith("Final_report_").endsWith(".md");
        assertThat(Files.readString(saved)).isEqualTo(markdown);
        assertThat(result.path("artifacts").get(0).path("type").asText()).isEqualTo("report");
        assertThat(result.path("message").asText()).startsWith("report generated: Final_report_");
    }
}
