package com.linlay.analysisagent.llm.model;

import java.util.List;

public record ChatRequest(
        List<ChatMessage> messages,
        List<LlmFunctionTool> tools,
        double temperature,
        int maxTokens
) {

    public ChatRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
