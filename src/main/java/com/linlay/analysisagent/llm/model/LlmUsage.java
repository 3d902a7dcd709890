package com.linlay.analysisagent.llm.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record LlmUsage(long inputTokens, long outputTokens) {

    public LlmUsage {
        inputTokens = Math.max(0, inputTokens);
        outputTokens = Math.max(0, outputTokens);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> usage = new LinkedHashMap<>();
        usage.put("input_tokens", inputTokens);
        usage.put("output_tokens", outputTokens);
        return usage;
    }
}
