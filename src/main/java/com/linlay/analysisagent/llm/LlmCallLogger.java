package com.linlay.analysisagent.llm;

import com.linlay.analysisagent.config.LlmInteractionLogProperties;
import com.linlay.analysisagent.llm.model.ChatMessage;
import com.linlay.analysisagent.llm.model.LlmChunk;
import com.linlay.analysisagent.llm.model.ToolCall;
import org.slf4j.Logger;
import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.UUID;

public class LlmCallLogger {

    private final boolean enabled;
    private final boolean maskSensitive;
    private final int maxLoggedChars;

    public LlmCallLogger() {
        this(null);
    }

    public LlmCallLogger(LlmInteractionLogProperties properties) {
        this.enabled = properties == null || properties.isEnabled();
        this.maskSensitive = properties == null || properties.isMaskSensitive();
        this.maxLoggedChars = properties == null ? 4000 : properties.getMaxLoggedChars();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String generateTraceId() {
        return "llm-" + UUID.randomUUID().toString().replace("-", "");
    }

    public long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    public String sanitizeText(String text) {
        return LlmLogSanitizer.truncate(LlmLogSanitizer.maskText(text, maskSensitive), maxLoggedChars);
    }

    public HttpHeaders sanitizeHeaders(HttpHeaders headers) {
        return LlmLogSanitizer.maskHeaders(headers, maskSensitive);
    }

    public void info(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.info(pattern, arguments);
        }
    }

    public void debug(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.debug(pattern, arguments);
        }
    }

    public void logMessages(Logger logger, String traceId, String providerId, List<ChatMessage> messages) {
        if (!enabled || !logger.isDebugEnabled() || messages == null || messages.isEmpty()) {
            return;
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < messages.size(); i++) {
            ChatMessage message = messages.get(i);
            if (message == null) {
                continue;
            }
            builder.append('[').append(i).append("] role=").append(message.role())
                    .append(", text=").append(sanitizeText(message.contentOrEmpty()));
            if (message.hasToolCalls()) {
                builder.append(", toolCalls=").append(message.toolCalls().size());
            }
            if (message.toolCallId() != null) {
                builder.append(", toolCallId=").append(message.toolCallId());
            }
            builder.append('\n');
        }
        logger.debug("[{}][{}] LLM request messages:\n{}", traceId, providerId, builder);
    }

    public void appendChunkLog(StringBuilder buffer, LlmChunk chunk) {
        if (!enabled || chunk == null) {
            return;
        }
        if (!chunk.text().isEmpty()) {
            buffer.append(sanitizeText(chunk.text()));
        }
        for (ToolCall call : chunk.toolCalls()) {
            buffer.append("\n[tool_call] id=").append(call.id())
                    .append(", name=").append(call.name())
                    .append(", args=").append(sanitizeText(call.arguments()));
        }
        if (chunk.finishReason() != null) {
            buffer.append("\n[finish_reason] ").append(chunk.finishReason());
        }
    }
}
