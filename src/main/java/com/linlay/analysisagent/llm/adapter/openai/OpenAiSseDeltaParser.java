package com.linlay.analysisagent.llm.adapter.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.llm.model.LlmDelta;
import com.linlay.analysisagent.llm.model.ToolCallDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class OpenAiSseDeltaParser {

    private static final Logger log = LoggerFactory.getLogger(OpenAiSseDeltaParser.class);

    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final ObjectMapper objectMapper;

    public OpenAiSseDeltaParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    // null when the chunk carries nothing usable
    public LlmDelta parseOrNull(String rawChunk) {
        String payload = stripEnvelope(rawChunk);
        if (payload == null) {
            return null;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            log.warn("Skip malformed OpenAI SSE chunk: {}", ex.getOriginalMessage());
            return null;
        }
        Map<String, Object> usage = readUsage(root.path("usage"));
        JsonNode choice = root.path("choices").path(0);
        if (choice.isMissingNode()) {
            return usage == null ? null : new LlmDelta(null, null, null, null, usage);
        }

        JsonNode body = choice.has("delta") ? choice.path("delta") : choice.path("message");
        String reasoning = firstText(body, "reasoning_content", "reasoning");
        String content = textOrNull(body.get("content"));
        String finishReason = textOrNull(choice.get("finish_reason"));
        List<ToolCallDelta> toolCalls = readToolCalls(body.path("tool_calls"));

        if (isEmpty(reasoning) && isEmpty(content) && toolCalls.isEmpty()
                && isBlank(finishReason) && usage == null) {
            return null;
        }
        return new LlmDelta(reasoning, content, toolCalls.isEmpty() ? null : toolCalls, finishReason, usage);
    }

    private List<ToolCallDelta> readToolCalls(JsonNode array) {
        if (!array.isArray()) {
            return List.of();
        }
        List<ToolCallDelta> fragments = new ArrayList<>(array.size());
        for (JsonNode item : array) {
            JsonNode function = item.path("function");
            String id = textOrNull(item.get("id"));
            Integer index = indexOrNull(item.get("index"));
            String name = textOrNull(function.get("name"));
            String arguments = textOrNull(function.get("arguments"));
            // some providers send completely empty fragments
            if (index == null && isBlank(id) && isBlank(name) && isBlank(arguments)) {
                continue;
            }
            fragments.add(new ToolCallDelta(id, index, textOrNull(item.get("type")), name, arguments));
        }
        return fragments;
    }

    private Map<String, Object> readUsage(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        Map<String, Object> usage = new LinkedHashMap<>();
        node.fields().forEachRemaining(field -> {
            JsonNode value = field.getValue();
            if (value.isIntegralNumber()) {
                usage.put(field.getKey(), value.asLong());
            } else if (value.isNumber()) {
                usage.put(field.getKey(), value.numberValue());
            } else if (value.isTextual()) {
                usage.put(field.getKey(), value.asText());
            }
        });
        return usage.isEmpty() ? null : usage;
    }

    private static String stripEnvelope(String rawChunk) {
        if (isBlank(rawChunk)) {
            return null;
        }
        String payload = rawChunk.trim();
        if (payload.startsWith(DATA_PREFIX)) {
            payload = payload.substring(DATA_PREFIX.length()).trim();
        }
        return isBlank(payload) || DONE_MARKER.equals(payload) ? null : payload;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = textOrNull(node.get(field));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    private static Integer indexOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToInt()) {
            return node.asInt();
        }
        String text = node.asText("").trim();
        return text.matches("\\d+") ? Integer.valueOf(text) : null;
    }

    private static boolean isEmpty(String text) {
        return text == null || text.isEmpty();
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
