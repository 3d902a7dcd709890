package com.linlay.analysisagent.llm.model;

import java.util.List;
import java.util.Map;

public record LlmDelta(
        String reasoning,
        String content,
        List<ToolCallDelta> toolCalls,
        String finishReason,
        Map<String, Object> usage
) {

    public LlmDelta(
            String content,
            List<ToolCallDelta> toolCalls,
            String finishReason
    ) {
        this(null, content, toolCalls, finishReason, null);
    }
}
