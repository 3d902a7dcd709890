package com.linlay.analysisagent.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentEvent(
        AgentEventType type,
        @JsonProperty("turn_id") String turnId,
        @JsonProperty("tool_call_id") String toolCallId,
        @JsonProperty("tool_name") String toolName,
        Object data,
        Map<String, Object> metadata,
        Instant timestamp
) {

    public static final String SEQ = "seq";

    public AgentEvent {
        if (type == null) {
            throw new IllegalArgumentException("event type must not be null");
        }
        turnId = turnId == null ? "" : turnId;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static AgentEvent of(AgentEventType type, String turnId, Object data) {
        return new AgentEvent(type, turnId, null, null, data, null, null);
    }

    public static AgentEvent forTool(AgentEventType type, String turnId, String toolCallId, String toolName, Object data) {
        return new AgentEvent(type, turnId, toolCallId, toolName, data, null, null);
    }

    public static AgentEvent text(String turnId, String text) {
        return of(AgentEventType.TEXT, turnId, text);
    }

    public static AgentEvent error(String turnId, String message) {
        return of(AgentEventType.ERROR, turnId, message);
    }

    public static AgentEvent done(String turnId) {
        return of(AgentEventType.DONE, turnId, null);
    }

    public AgentEvent withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new AgentEvent(type, turnId, toolCallId, toolName, data, merged, timestamp);
    }

    public AgentEvent withSeq(long seq) {
        return withMetadata(SEQ, seq);
    }

    public long seq() {
        Object value = metadata.get(SEQ);
        return value instanceof Number number ? number.longValue() : 0L;
    }

    public boolean isTerminal() {
        return type.isTerminal();
    }
}
