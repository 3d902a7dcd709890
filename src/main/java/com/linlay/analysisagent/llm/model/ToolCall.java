package com.linlay.analysisagent.llm.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record ToolCall(
        String id,
        String type,
        String name,
        String arguments
) {

    public ToolCall {
        if (type == null || type.isBlank()) {
            type = "function";
        }
        if (name == null) {
            name = "";
        }
        if (arguments == null) {
            arguments = "";
        }
    }

    public static ToolCall function(String id, String name, String arguments) {
        return new ToolCall(id, "function", name, arguments);
    }

    // OpenAI shape: {id, type, function: {name, arguments}}
    public Map<String, Object> toMap() {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("arguments", arguments);
        Map<String, Object> call = new LinkedHashMap<>();
        call.put("id", id == null ? "" : id);
        call.put("type", type);
        call.put("function", function);
        return call;
    }
}
