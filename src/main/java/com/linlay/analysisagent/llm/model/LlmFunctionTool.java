package com.linlay.analysisagent.llm.model;

import java.util.Map;

public record LlmFunctionTool(
        String name,
        String description,
        Map<String, Object> parameters
) {
}
