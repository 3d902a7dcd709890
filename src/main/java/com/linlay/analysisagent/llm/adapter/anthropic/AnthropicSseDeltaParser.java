package com.linlay.analysisagent.llm.adapter.anthropic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.llm.ProviderException;
import com.linlay.analysisagent.llm.model.LlmDelta;
import com.linlay.analysisagent.llm.model.ToolCallDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class AnthropicSseDeltaParser {

    private static final Logger log = LoggerFactory.getLogger(AnthropicSseDeltaParser.class);

    private final ObjectMapper objectMapper;
    private final String providerId;

    public AnthropicSseDeltaParser(ObjectMapper objectMapper, String providerId) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.providerId = providerId;
    }

    public LlmDelta parseOrNull(String rawChunk) {
        if (rawChunk == null || rawChunk.isBlank()) {
            return null;
        }
        String payload = rawChunk.trim();
        if (payload.startsWith("data:")) {
            payload = payload.substring(5).trim();
        }
        if (!payload.startsWith("{")) {
            return null;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException ex) {
            log.warn("Failed to parse Anthropic SSE chunk: {}", rawChunk, ex);
            return null;
        }
        String type = root.path("type").asText("");
        return switch (type) {
            case "message_start" -> usageDelta(root.path("message").path("usage"));
            case "content_block_start" -> contentBlockStart(root);
            case "content_block_delta" -> contentBlockDelta(root);
            case "message_delta" -> messageDelta(root);
            case "error" -> throw new ProviderException(
                    providerId,
                    "Anthropic stream error: " + root.path("error").path("message").asText(root.toString())
            );
            default -> null;
        };
    }

    private LlmDelta contentBlockStart(JsonNode root) {
        JsonNode block = root.path("content_block");
        int index = root.path("index").asInt(0);
        String blockType = block.path("type").asText("");
        if ("tool_use".equals(blockType)) {
            return new LlmDelta(null, null, List.of(new ToolCallDelta(
                    block.path("id").asText(null),
                    index,
                    "function",
                    block.path("name").asText(null),
                    null
            )), null, null);
        }
        if ("text".equals(blockType) && !block.path("text").asText("").isEmpty()) {
            return new LlmDelta(null, block.path("text").asText(), null, null, null);
        }
        return null;
    }

    private LlmDelta contentBlockDelta(JsonNode root) {
        JsonNode delta = root.path("delta");
        int index = root.path("index").asInt(0);
        return switch (delta.path("type").asText("")) {
            case "text_delta" -> new LlmDelta(null, delta.path("text").asText(""), null, null, null);
            case "thinking_delta" -> new LlmDelta(delta.path("thinking").asText(""), null, null, null, null);
            case "input_json_delta" -> new LlmDelta(null, null, List.of(new ToolCallDelta(
                    null,
                    index,
                    "function",
                    null,
                    delta.path("partial_json").asText("")
            )), null, null);
            default -> null;
        };
    }

    private LlmDelta messageDelta(JsonNode root) {
        String stopReason = root.path("delta").path("stop_reason").asText(null);
        Map<String, Object> usage = usageMap(root.path("usage"));
        if (stopReason == null && usage == null) {
            return null;
        }
        return new LlmDelta(null, null, null, normalizeStopReason(stopReason), usage);
    }

    private LlmDelta usageDelta(JsonNode usageNode) {
        Map<String, Object> usage = usageMap(usageNode);
        return usage == null ? null : new LlmDelta(null, null, null, null, usage);
    }

    private Map<String, Object> usageMap(JsonNode usageNode) {
        if (usageNode == null || !usageNode.isObject()) {
            return null;
        }
        Map<String, Object> usage = new LinkedHashMap<>();
        if (usageNode.has("input_tokens")) {
            usage.put("input_tokens", usageNode.path("input_tokens").asLong());
        }
        if (usageNode.has("output_tokens")) {
            usage.put("output_tokens", usageNode.path("output_tokens").asLong());
        }
        return usage.isEmpty() ? null : usage;
    }

    static String normalizeStopReason(String stopReason) {
        if (stopReason == null) {
            return null;
        }
        return switch (stopReason) {
            case "tool_use" -> "tool_calls";
            case "end_turn", "stop_sequence" -> "stop";
            case "max_tokens" -> "length";
            default -> stopReason;
        };
    }
}
