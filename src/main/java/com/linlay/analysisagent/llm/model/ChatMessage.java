package com.linlay.analysisagent.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessage(
        String role,
        String content,
        @JsonProperty("tool_calls") List<ToolCall> toolCalls,
        @JsonProperty("tool_call_id") String toolCallId,
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("event_type") String eventType,
        Map<String, Object> metadata
) {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    public ChatMessage {
        toolCalls = toolCalls == null || toolCalls.isEmpty() ? null : List.copyOf(toolCalls);
        metadata = metadata == null || metadata.isEmpty() ? null : Map.copyOf(metadata);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content, null, null, null, null, null);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content, null, null, null, null, null);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ASSISTANT, content, null, null, null, null, null);
    }

    public static ChatMessage assistantToolCalls(String content, List<ToolCall> toolCalls) {
        return new ChatMessage(ASSISTANT, content, toolCalls, null, null, null, null);
    }

    public static ChatMessage tool(String toolCallId, String toolName, String content) {
        return new ChatMessage(TOOL, content, null, toolCallId, toolName, null, null);
    }

    public static ChatMessage note(String eventType, String content, Map<String, Object> metadata) {
        return new ChatMessage(ASSISTANT, content, null, null, null, eventType, metadata);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean isDialog() {
        return eventType == null || eventType.isBlank();
    }

    public String contentOrEmpty() {
        return content == null ? "" : content;
    }
}
