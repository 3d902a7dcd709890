package com.linlay.analysisagent.agent.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;

/**
 * Shrinks tool results before they enter history. Only status and shape-level fields survive;
 * chart JSON and data previews are dropped.
 */
public final class ToolResultCompactor {

    public static final String TRUNCATED_SUFFIX = "...(truncated)";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String[] STATUS_KEYS = {"success", "message", "error", "status"};
    private static final String[] FLAG_KEYS = {"has_chart", "has_dataframe"};
    private static final String[] IDENTITY_KEYS = {"name", "dataset_name", "chart_type", "journal_style"};
    private static final String[] COUNT_KEYS = {"rows", "columns", "preview_rows", "total_rows"};
    private static final int MAX_DATA_KEYS = 10;
    private static final int MAX_ARTIFACT_NAMES = 5;

    private ToolResultCompactor() {
    }

    public static ObjectNode summarize(JsonNode result) {
        ObjectNode compact = OBJECT_MAPPER.createObjectNode();
        if (result == null || !result.isObject()) {
            compact.put("message", "tool execution completed");
            return compact;
        }
        for (String key : STATUS_KEYS) {
            if (result.has(key)) {
                compact.set(key, result.get(key));
            }
        }
        for (String key : FLAG_KEYS) {
            if (result.has(key)) {
                compact.put(key, truthy(result.get(key)));
            }
        }
        JsonNode data = result.get("data");
        if (data != null && data.isObject()) {
            compact.set("data_summary", summarizeData(data));
        }
        JsonNode artifacts = result.get("artifacts");
        if (artifacts != null && artifacts.isArray()) {
            compact.put("artifact_count", artifacts.size());
            ArrayNode names = OBJECT_MAPPER.createArrayNode();
            for (int i = 0; i < artifacts.size() && i < MAX_ARTIFACT_NAMES; i++) {
                JsonNode name = artifacts.get(i).path("name");
                if (name.isTextual() && !name.asText().isEmpty()) {
                    names.add(name.asText());
                }
            }
            if (!names.isEmpty()) {
                compact.set("artifact_names", names);
            }
        }
        JsonNode images = result.get("images");
        if (images != null && images.isArray()) {
            compact.put("image_count", images.size());
        } else if (images != null && images.isTextual() && !images.asText().isEmpty()) {
            compact.put("image_count", 1);
        }
        if (compact.isEmpty()) {
            compact.put("message", "tool execution completed");
        }
        return compact;
    }

    public static String serializeForHistory(JsonNode result, int maxChars) {
        if (result != null && result.isObject()) {
            return truncate(summarize(result).toString(), maxChars);
        }
        return compactContent(result == null ? "" : result.isTextual() ? result.asText() : result.toString(), maxChars);
    }

    public static String compactContent(String content, int maxChars) {
        String text = content == null ? "" : content;
        String stripped = text.trim();
        if (stripped.startsWith("{") && stripped.endsWith("}")) {
            try {
                JsonNode parsed = OBJECT_MAPPER.readTree(stripped);
                if (parsed != null && parsed.isObject()) {
                    text = summarize(parsed).toString();
                }
            } catch (JsonProcessingException ex) {
                // not JSON, truncate as plain text
                text = content;
            }
        }
        return truncate(text, maxChars);
    }

    static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + TRUNCATED_SUFFIX;
    }

    private static ObjectNode summarizeData(JsonNode data) {
        ObjectNode summary = OBJECT_MAPPER.createObjectNode();
        for (String key : IDENTITY_KEYS) {
            if (data.has(key)) {
                summary.set(key, data.get(key));
            }
        }
        JsonNode shape = data.get("shape");
        if (shape != null && shape.isObject()) {
            ObjectNode shapeSummary = summary.putObject("shape");
            shapeSummary.set("rows", shape.path("rows").isMissingNode() ? null : shape.get("rows"));
            shapeSummary.set("columns", shape.path("columns").isMissingNode() ? null : shape.get("columns"));
        }
        for (String key : COUNT_KEYS) {
            JsonNode value = data.get(key);
            if (value != null && value.isIntegralNumber()) {
                summary.set(key, value);
            }
        }
        ArrayNode keys = summary.putArray("keys");
        Iterator<String> names = data.fieldNames();
        while (names.hasNext() && keys.size() < MAX_DATA_KEYS) {
            keys.add(names.next());
        }
        return summary;
    }

    private static boolean truthy(JsonNode value) {
        if (value == null || value.isNull()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.doubleValue() != 0d;
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty();
        }
        return !value.isEmpty();
    }
}
