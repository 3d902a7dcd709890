package com.linlay.analysisagent.agent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AgentEventType {
    ITERATION_START,
    TEXT,
    REASONING,
    RETRIEVAL,
    TOOL_CALL,
    TOOL_RESULT,
    CHART,
    DATA,
    ARTIFACT,
    IMAGE,
    ANALYSIS_PLAN,
    PLAN_STEP_UPDATE,
    CONTEXT_COMPRESSED,
    ERROR,
    DONE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
