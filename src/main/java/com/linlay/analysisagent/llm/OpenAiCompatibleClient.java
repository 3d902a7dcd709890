package com.linlay.analysisagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.llm.adapter.openai.OpenAiSseDeltaParser;
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
import java.util.regex.Pattern;

public class OpenAiCompatibleClient extends AbstractSseProviderClient {

    private static final Pattern VERSIONED_PATH = Pattern.compile(".*/v\\d+/?$");

    private final OpenAiSseDeltaParser deltaParser;

    public OpenAiCompatibleClient(
            ProviderSettings settings,
            ObjectMapper objectMapper,
            LlmCallLogger callLogger,
            Duration streamTimeout
    ) {
        super(settings, objectMapper, callLogger, streamTimeout);
        this.deltaParser = new OpenAiSseDeltaParser(objectMapper);
    }

    @Override
    protected String completionsUri(String baseUrl) {
        String normalized = baseUrl == null ? "" : baseUrl.trim().toLowerCase(Locale.ROOT);
        if (VERSIONED_PATH.matcher(normalized).matches()) {
            return "/chat/completions";
        }
        return "/v1/chat/completions";
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        if (StringUtils.hasText(settings.apiKey())) {
            headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + settings.apiKey());
        }
    }

    @Override
    protected LlmDelta parseDelta(String rawChunk) {
        return deltaParser.parseOrNull(rawChunk);
    }

    @Override
    protected Map<String, Object> buildRequestBody(ChatRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", settings.model());
        body.put("messages", buildRawMessages(request.messages()));
        body.put("temperature", settings.resolveTemperature(request.temperature()));
        if (request.maxTokens() > 0) {
            body.put("max_tokens", request.maxTokens());
        }
        body.put("stream", true);
        if (settings.streamUsage()) {
            body.put("stream_options", Map.of("include_usage", true));
        }
        List<Map<String, Object>> rawTools = buildRawTools(request.tools());
        if (!rawTools.isEmpty()) {
            body.put("tools", rawTools);
            body.put("tool_choice", "auto");
        }
        return body;
    }

    private List<Map<String, Object>> buildRawMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> rawMessages = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message == null || !message.isDialog()) {
                continue;
            }
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("role", message.role());
            raw.put("content", message.contentOrEmpty());
            if (message.hasToolCalls()) {
                List<Map<String, Object>> toolCalls = new ArrayList<>();
                for (ToolCall call : message.toolCalls()) {
                    toolCalls.add(call.toMap());
                }
                raw.put("tool_calls", toolCalls);
            }
            if (ChatMessage.TOOL.equals(message.role()) && message.toolCallId() != null) {
                raw.put("tool_call_id", message.toolCallId());
            }
            rawMessages.add(raw);
        }
        return rawMessages;
    }

    private List<Map<String, Object>> buildRawTools(List<LlmFunctionTool> tools) {
        List<Map<String, Object>> rawTools = new ArrayList<>();
        for (LlmFunctionTool tool : tools) {
            if (tool == null || !StringUtils.hasText(tool.name())) {
                continue;
            }
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", tool.name());
            if (StringUtils.hasText(tool.description())) {
                function.put("description", tool.description());
            }
            function.put("parameters", tool.parameters() == null ? Map.of(
                    "type", "object",
                    "properties", Map.of(),
                    "additionalProperties", true
            ) : tool.parameters());
            Map<String, Object> toolMap = new LinkedHashMap<>();
            toolMap.put("type", "function");
            toolMap.put("function", function);
            rawTools.add(toolMap);
        }
        return rawTools;
    }
}
