package com.linlay.analysisagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.analysisagent.agent.Session;

import java.util.Map;

/**
 * A capability the model calls by name. The runner depends only on this interface.
 */
public interface BaseTool {

    String name();

    default String description() {
        return "";
    }

    default Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(),
                "additionalProperties", true
        );
    }

    /**
     * Returns a JSON object; an {@code error} field or {@code success=false} marks failure.
     */
    JsonNode invoke(Session session, Map<String, Object> args);
}
