package com.linlay.analysisagent.agent.plan;

import java.util.LinkedHashMap;
import java.util.Map;

public record PlanStep(int id, String title, String toolHint, PlanStepStatus status) {

    public PlanStep {
        title = title == null ? "" : title.trim();
        toolHint = toolHint == null || toolHint.isBlank() ? null : toolHint.trim();
        status = status == null ? PlanStepStatus.PENDING : status;
    }

    public PlanStep withStatus(PlanStepStatus next) {
        return new PlanStep(id, title, toolHint, next);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("title", title);
        map.put("tool_hint", toolHint);
        map.put("status", status.wireName());
        return map;
    }
}
