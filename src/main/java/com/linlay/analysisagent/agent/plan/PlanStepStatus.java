package com.linlay.analysisagent.agent.plan;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PlanStepStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
