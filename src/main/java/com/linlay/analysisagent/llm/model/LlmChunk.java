package com.linlay.analysisagent.llm.model;

import java.util.List;

public record LlmChunk(
        String text,
        String reasoning,
        String rawText,
        List<ToolCall> toolCalls,
        String finishReason,
        LlmUsage usage
) {

    public LlmChunk {
        text = text == null ? "" : text;
        reasoning = reasoning == null ? "" : reasoning;
        rawText = rawText == null ? "" : rawText;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static LlmChunk text(String text) {
        return new LlmChunk(text, null, text, null, null, null);
    }

    public static LlmChunk reasoning(String reasoning) {
        return new LlmChunk(null, reasoning, null, null, null, null);
    }

    public static LlmChunk toolCalls(List<ToolCall> toolCalls) {
        return new LlmChunk(null, null, null, toolCalls, "tool_calls", null);
    }

    public static LlmChunk finish(String finishReason) {
        return new LlmChunk(null, null, null, null, finishReason, null);
    }

    public static LlmChunk usage(LlmUsage usage) {
        return new LlmChunk(null, null, null, null, null, usage);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public boolean hasOutput() {
        return !text.isEmpty() || !reasoning.isEmpty() || !toolCalls.isEmpty();
    }
}
