package com.linlay.analysisagent.agent.context;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolResultCompactorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldKeepStatusAndShapeButDropLargePayloads() throws Exception {
        JsonNode result = objectMapper.readTree("""
                {
                  "success": true,
                  "message": "done",
                  "has_chart": 1,
                  "has_dataframe": "",
                  "chart_data": {"data": [1, 2, 3]},
                  "dataframe_preview": {"data": [{"a": 1}]},
                  "data": {"name": "volcano", "shape": {"rows": 10, "columns": 3}, "rows": 10, "stdout": "x"},
                  "artifacts": [{"name": "a.png"}, {"name": "b.svg"}],
                  "images": ["/files/a.png"]
                }
                """);

        ObjectNode compact = ToolResultCompactor.summarize(result);

        assertThat(compact.path("success").asBoolean()).isTrue();
        assertThat(compact.path("message").asText()).isEqualTo("done");
        assertThat(compact.path("has_chart").asBoolean()).isTrue();
        assertThat(compact.path("has_dataframe").asBoolean()).isFalse();
        assertThat(compact.has("chart_data")).isFalse();
        assertThat(compact.has("dataframe_preview")).isFalse();
        assertThat(compact.path("data_summary").path("name").asText()).isEqualTo("volcano");
        assertThat(compact.path("data_summary").path("shape").path("rows").asInt()).isEqualTo(10);
        assertThat(compact.path("data_summary").path("keys").size()).isEqualTo(4);
        assertThat(compact.path("artifact_count").asInt()).isEqualTo(2);
        assertThat(compact.path("artifact_names").toString()).isEqualTo("[\"a.png\",\"b.svg\"]");
        assertThat(compact.path("image_count").asInt()).isEqualTo(1);
    }

    @Test
    void shouldFallBackToCompletedMessageForEmptyResults() {
        assertThat(ToolResultCompactor.summarize(objectMapper.createObjectNode()).path("message").asText())
                .isEqualTo("tool execution completed");
        assertThat(ToolResultCompactor.summarize(null).path("message").asText()).isEqualTo("tool execution completed");
    }

    @Test
    void shouldTruncatePlainTextAndSummarizeJsonContent() {
        String longText = "x".repeat(50);

        assertThat(ToolResultCompactor.compactContent(longText, 10)).isEqualTo("xxxxxxxxxx" + ToolResultCompactor.TRUNCATED_SUFFIX);
        assertThat(ToolResultCompactor.compactContent("{\"error\":\"boom\",\"chart_data\":{}}", 2000))
                .isEqualTo("{\"error\":\"boom\"}");
        assertThat(ToolResultCompactor.compactContent("{not json}", 2000)).isEqualTo("{not json}");
    }

    @Test
    void shouldSerializeObjectsThroughSummary() {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("error", "dataset 'x' does not exist");
        result.put("traceback", "very long traceback");

        assertThat(ToolResultCompactor.serializeForHistory(result, 2000)).isEqualTo("{\"error\":\"dataset 'x' does not exist\"}");
        assertThat(ToolResultCompactor.serializeForHistory(objectMapper.getNodeFactory().textNode("plain"), 2000)).isEqualTo("plain");
    }
}
