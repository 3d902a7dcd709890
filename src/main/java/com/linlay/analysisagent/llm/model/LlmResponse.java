package com.linlay.analysisagent.llm.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class LlmResponse {

    private final StringBuilder text = new StringBuilder();
    private final StringBuilder reasoning = new StringBuilder();
    private final List<ToolCall> toolCalls = new ArrayList<>();
    private final Set<String> finishReasons = new LinkedHashSet<>();
    private LlmUsage usage;

    public static LlmResponse fold(List<LlmChunk> chunks) {
        LlmResponse response = new LlmResponse();
        if (chunks != null) {
            chunks.forEach(response::accept);
        }
        return response;
    }

    public LlmResponse accept(LlmChunk chunk) {
        if (chunk == null) {
            return this;
        }
        text.append(chunk.text());
        reasoning.append(chunk.reasoning());
        toolCalls.addAll(chunk.toolCalls());
        if (chunk.finishReason() != null && !chunk.finishReason().isBlank()) {
            finishReasons.add(chunk.finishReason());
        }
        if (chunk.usage() != null) {
            usage = chunk.usage();
        }
        return this;
    }

    public String text() {
        return text.toString();
    }

    public String reasoning() {
        return reasoning.toString();
    }

    public List<ToolCall> toolCalls() {
        return List.copyOf(toolCalls);
    }

    public Set<String> finishReasons() {
        return Set.copyOf(finishReasons);
    }

    public LlmUsage usage() {
        return usage;
    }
}
