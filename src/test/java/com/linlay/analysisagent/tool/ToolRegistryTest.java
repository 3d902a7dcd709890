package com.linlay.analysisagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.agent.Session;
import com.linlay.analysisagent.agent.SessionLaneQueue;
import com.linlay.analysisagent.agent.ToolExecutionException;
import com.linlay.analysisagent.llm.model.LlmFunctionTool;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldReturnErrorResultForUnknownTool() {
        ToolRegistry registry = new ToolRegistry(List.of(), new SessionLaneQueue());

        JsonNode result = registry.execute("missing_tool", new Session("s1"), Map.of());

        assertThat(result.path("error").asText()).isEqualTo("unknown tool: missing_tool");
    }

    @Test
    void shouldResolveNamesCaseInsensitively() {
        ToolRegistry registry = new ToolRegistry(List.of(echo("Echo_Args")), new SessionLaneQueue());

        JsonNode result = registry.execute(" echo_args ", new Session("s1"), Map.of("value", 3));

        assertThat(result.path("value").asInt()).isEqualTo(3);
        assertThat(registry.find("ECHO_ARGS")).isPresent();
        assertThat(registry.find("other")).isEmpty();
    }

    @Test
    void shouldWrapToolExceptions() {
        BaseTool failing = new BaseTool() {
            @Override
            public String name() {
                return "failing";
            }

            @Override
            public JsonNode invoke(Session session, Map<String, Object> args) {
                throw new IllegalStateException("sandbox unavailable");
            }
        };
        ToolRegistry registry = new ToolRegistry(List.of(failing), new SessionLaneQueue());

        assertThatThrownBy(() -> registry.execute("failing", new Session("s1"), null))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("sandbox unavailable")
                .hasCauseInstanceOf(IllegalStateException.class)
                .satisfies(ex -> assertThat(((ToolExecutionException) ex).toolName()).isEqualTo("failing"));
    }

    @Test
    void shouldExposeDefinitionsSortedByName() {
        ToolRegistry registry = new ToolRegistry(List.of(echo("zeta"), echo("alpha"), echo("Alpha")), new SessionLaneQueue());

        List<LlmFunctionTool> definitions = registry.definitions();

        assertThat(definitions).extracting(LlmFunctionTool::name).containsExactly("alpha", "zeta");
        assertThat(definitions.get(0).parameters()).containsEntry("type", "object");
        assertThat(definitions.get(0).description()).isEqualTo("echoes alpha");
    }

    private BaseTool echo(String name) {
        return new BaseTool() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String description() {
                return "echoes " + name;
            }

            @Override
            public JsonNode invoke(Session session, Map<String, Object> args) {
                return objectMapper.valueToTree(args);
            }
        };
    }
}
