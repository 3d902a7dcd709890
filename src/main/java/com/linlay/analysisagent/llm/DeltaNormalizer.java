package com.linlay.analysisagent.llm;

import com.linlay.analysisagent.llm.model.LlmChunk;
import com.linlay.analysisagent.llm.model.LlmDelta;
import com.linlay.analysisagent.llm.model.LlmUsage;
import com.linlay.analysisagent.llm.model.ToolCall;
import com.linlay.analysisagent.llm.model.ToolCallDelta;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

// one instance per subscription
public final class DeltaNormalizer {

    private final CumulativeTextNormalizer contentText;
    private final CumulativeTextNormalizer reasoningText;
    private final ThinkTagParser thinkTags = new ThinkTagParser();
    private final ToolCallAccumulator toolCalls = new ToolCallAccumulator();
    private Long inputTokens;
    private Long outputTokens;

    public DeltaNormalizer() {
        this(false);
    }

    public DeltaNormalizer(boolean cumulativeText) {
        this.contentText = new CumulativeTextNormalizer(cumulativeText);
        this.reasoningText = new CumulativeTextNormalizer(cumulativeText);
    }

    public LlmChunk apply(LlmDelta delta) {
        if (delta == null) {
            return null;
        }
        String raw = contentText.toDelta(delta.content());
        ThinkTagParser.Segment segment = thinkTags.feed(raw);
        String reasoning = reasoningText.toDelta(delta.reasoning()) + segment.reasoning();

        if (delta.toolCalls() != null) {
            for (ToolCallDelta toolCallDelta : delta.toolCalls()) {
                toolCalls.accept(toolCallDelta);
            }
        }
        String finishReason = blankToNull(delta.finishReason());
        List<ToolCall> closed = "tool_calls".equals(finishReason) ? toolCalls.drain() : List.of();
        LlmUsage usage = mergeUsage(delta.usage());

        if (segment.text().isEmpty() && reasoning.isEmpty() && raw.isEmpty()
                && closed.isEmpty() && finishReason == null && usage == null) {
            return null;
        }
        return new LlmChunk(segment.text(), reasoning, raw, closed, finishReason, usage);
    }

    // flushes buffered think text and tool calls that never saw a tool_calls finish reason
    public List<LlmChunk> complete() {
        List<LlmChunk> chunks = new ArrayList<>(2);
        ThinkTagParser.Segment rest = thinkTags.flush();
        if (!rest.isEmpty()) {
            chunks.add(new LlmChunk(rest.text(), rest.reasoning(), null, null, null, null));
        }
        if (toolCalls.hasPending()) {
            chunks.add(LlmChunk.toolCalls(toolCalls.drain()));
        }
        return chunks;
    }

    private LlmUsage mergeUsage(Map<String, Object> usage) {
        if (usage == null || usage.isEmpty()) {
            return null;
        }
        Long input = readTokens(usage, "prompt_tokens", "input_tokens");
        Long output = readTokens(usage, "completion_tokens", "output_tokens");
        if (input == null && output == null) {
            return null;
        }
        if (input != null) {
            inputTokens = input;
        }
        if (output != null) {
            outputTokens = output;
        }
        return new LlmUsage(
                inputTokens == null ? 0 : inputTokens,
                outputTokens == null ? 0 : outputTokens
        );
    }

    private Long readTokens(Map<String, Object> usage, String... keys) {
        for (String key : keys) {
            Object value = usage.get(key);
            if (value instanceof Number number) {
                return number.longValue();
            }
            if (value instanceof String text && !text.isBlank()) {
                try {
                    return Long.parseLong(text.trim());
                } catch (NumberFormatException ex) {
                    return null;
                }
            }
        }
        return null;
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
