package com.linlay.analysisagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.analysisagent.agent.Session;
import com.linlay.analysisagent.agent.SessionLaneQueue;
import com.linlay.analysisagent.agent.ToolExecutionException;
import com.linlay.analysisagent.llm.model.LlmFunctionTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Map<String, BaseTool> toolsByName;
    private final SessionLaneQueue lanes;

    public ToolRegistry(List<BaseTool> tools, SessionLaneQueue lanes) {
        this.toolsByName = tools.stream().collect(Collectors.toMap(
                tool -> normalizeName(tool.name()),
                Function.identity(),
                (left, right) -> left,
                LinkedHashMap::new
        ));
        this.lanes = lanes;
    }

    // runs inside the session lane; unknown tools give an error result and tool exceptions
    // are wrapped in ToolExecutionException
    public JsonNode execute(String toolName, Session session, Map<String, Object> args) {
        BaseTool tool = toolsByName.get(normalizeName(toolName));
        if (Objects.isNull(tool)) {
            log.warn("Unknown tool requested: {}", toolName);
            ObjectNode error = OBJECT_MAPPER.createObjectNode();
            error.put("error", "unknown tool: " + toolName);
            return error;
        }
        Map<String, Object> safeArgs = args == null ? Map.of() : args;
        try {
            return lanes.execute(session.id(), () -> tool.invoke(session, safeArgs));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException(tool.name(), "interrupted while waiting for session lane", ex);
        } catch (ToolExecutionException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new ToolExecutionException(tool.name(), ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(), ex);
        }
    }

    public Optional<BaseTool> find(String toolName) {
        return Optional.ofNullable(toolsByName.get(normalizeName(toolName)));
    }

    public List<BaseTool> list() {
        return toolsByName.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(Map.Entry::getValue)
                .toList();
    }

    public List<LlmFunctionTool> definitions() {
        return list().stream()
                .map(tool -> new LlmFunctionTool(normalizeName(tool.name()), tool.description(), tool.parametersSchema()))
                .toList();
    }

    private String normalizeName(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }
}
