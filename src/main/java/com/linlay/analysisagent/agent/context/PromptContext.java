package com.linlay.analysisagent.agent.context;

import com.linlay.analysisagent.llm.model.ChatMessage;

import java.util.List;
import java.util.Map;

public record PromptContext(
        List<ChatMessage> messages,
        Map<String, Object> retrieval,
        int estimatedTokens,
        int untrimmedTokens
) {

    public PromptContext {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
