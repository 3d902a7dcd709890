package com.linlay.analysisagent.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;
import java.util.Map;

public abstract class AbstractAnalysisTool implements BaseTool {

    protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    protected String readText(Map<String, Object> args, String key) {
        if (args == null) {
            return null;
        }
        Object value = args.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    // code keeps its indentation, only blankness is checked
    protected String readCode(Map<String, Object> args, String key) {
        Object value = args == null ? null : args.get(key);
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        return value.toString();
    }

    protected boolean readBoolean(Map<String, Object> args, String key, boolean defaultValue) {
        Object value = args == null ? null : args.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        if (value instanceof String text && !text.isBlank()) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
        }
        return defaultValue;
    }

    protected ObjectNode failure(String message) {
        ObjectNode result = OBJECT_MAPPER.createObjectNode();
        result.put("success", false);
        result.put("message", message);
        result.put("error", message);
        return result;
    }
}
