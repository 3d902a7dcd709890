package com.linlay.analysisagent.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.llm.adapter.anthropic.AnthropicSseDeltaParser;
import com.linlay.analysisagent.llm.model.ChatMessage;
import com.linlay.analysisagent.llm.model.ChatRequest;
import com.linlay.analysisagent.llm.model.LlmDelta;
import com.linlay.analysisagent.llm.model.LlmFunctionTool;
import com.linlay.analysisagent.llm.model.ToolCall;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

// no tool role in this protocol: tool results become assistant summaries, tool calls become JSON text
public class AnthropicClient extends AbstractSseProviderClient {

    static final String API_VERSION = "2023-06-01";
    private static final int MAX_TOOL_CONTEXT_CHARS = 2000;

    private final AnthropicSseDeltaParser deltaParser;

    public AnthropicClient(
            ProviderSettings settings,
            ObjectMapper objectMapper,
            LlmCallLogger callLogger,
            Duration streamTimeout
    ) {
        super(settings, objectMapper, callLogger, streamTimeout);
        this.deltaParser = new AnthropicSseDeltaParser(objectMapper, settings.providerId());
    }

    @Override
    protected String completionsUri(String baseUrl) {
        String normalized = baseUrl == null ? "" : baseUrl.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("/v1") || normalized.endsWith("/v1/")) {
            return "/messages";
        }
        return "/v1/messages";
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        headers.set("x-api-key", settings.apiKey());
        headers.set("anthropic-version", API_VERSION);
    }

    @Override
    protected LlmDelta parseDelta(String rawChunk) {
        return deltaParser.parseOrNull(rawChunk);
    }

    @Override
    protected Map<String, Object> buildRequestBody(ChatRequest request) {
        List<String> systemParts = new ArrayList<>();
        List<Map<String, Object>> messages = convertMessages(request.messages(), systemParts);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", settings.model());
        body.put("max_tokens", request.maxTokens() > 0 ? request.maxTokens() : 4096);
        body.put("temperature", settings.resolveTemperature(request.temperature()));
        body.put("stream", true);
        if (!systemParts.isEmpty()) {
            body.put("system", String.join("\n\n", systemParts));
        }
        body.put("messages", messages);
        List<Map<String, Object>> tools = convertTools(request.tools());
        if (!tools.isEmpty()) {
            body.put("tools", tools);
        }
        return body;
    }

    List<Map<String, Object>> convertMessages(List<ChatMessage> source, List<String> systemParts) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ChatMessage message : source) {
            if (message == null || !message.isDialog()) {
                continue;
            }
            String role = message.role();
            if (ChatMessage.SYSTEM.equals(role)) {
                if (StringUtils.hasText(message.content())) {
                    systemParts.add(message.content());
                }
                continue;
            }
            if (ChatMessage.TOOL.equals(role)) {
                out.add(textMessage(ChatMessage.ASSISTANT, summarizeToolContext(message.content())));
                continue;
            }
            if (!ChatMessage.USER.equals(role) && !ChatMessage.ASSISTANT.equals(role)) {
                role = ChatMessage.USER;
            }
            String content = message.content();
            if (!StringUtils.hasText(content) && message.hasToolCalls()) {
                content = toJson(message.toolCalls().stream().map(ToolCall::toMap).toList());
            }
            out.add(textMessage(role, content == null ? "" : content));
        }
        if (out.isEmpty()) {
            out.add(textMessage(ChatMessage.USER, "hello"));
        }
        return out;
    }

    String summarizeToolContext(String content) {
        String text = content == null ? "" : content;
        String stripped = text.strip();
        if (stripped.startsWith("{") && stripped.endsWith("}")) {
            try {
                JsonNode payload = objectMapper.readTree(stripped);
                Map<String, Object> compact = new LinkedHashMap<>();
                for (String key : List.of("success", "message", "error", "status")) {
                    if (payload.has(key)) {
                        compact.put(key, objectMapper.treeToValue(payload.get(key), Object.class));
                    }
                }
                for (String key : List.of("has_chart", "has_dataframe")) {
                    if (payload.has(key)) {
                        compact.put(key, payload.get(key).asBoolean());
                    }
                }
                JsonNode data = payload.get("data");
                if (data != null && data.isObject()) {
                    List<String> keys = new ArrayList<>();
                    data.fieldNames().forEachRemaining(keys::add);
                    compact.put("data_keys", keys.subList(0, Math.min(8, keys.size())));
                }
                text = toJson(compact);
            } catch (JsonProcessingException ex) {
                // not JSON, truncate as is
                text = content;
            }
        }
        if (text.length() > MAX_TOOL_CONTEXT_CHARS) {
            text = text.substring(0, MAX_TOOL_CONTEXT_CHARS) + "...(truncated)";
        }
        return "[tool result]\n" + text;
    }

    private List<Map<String, Object>> convertTools(List<LlmFunctionTool> tools) {
        List<Map<String, Object>> converted = new ArrayList<>();
        for (LlmFunctionTool tool : tools) {
            if (tool == null || !StringUtils.hasText(tool.name())) {
                continue;
            }
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", tool.name());
            item.put("description", tool.description() == null ? "" : tool.description());
            item.put("input_schema", tool.parameters() == null ? Map.of("type", "object") : tool.parameters());
            converted.add(item);
        }
        return converted;
    }

    private Map<String, Object> textMessage(String role, String content) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }
}
