package com.linlay.analysisagent.agent.plan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plan parsed from the first model reply. Pending steps claim tool calls in order; the tool name a
 * step declares is not checked.
 */
public class AnalysisPlan {

    private final List<PlanStep> steps;
    private final String rawText;

    public AnalysisPlan(List<PlanStep> steps, String rawText) {
        this.steps = new ArrayList<>(steps == null ? List.of() : steps);
        this.rawText = rawText == null ? "" : rawText;
    }

    public synchronized List<PlanStep> steps() {
        return List.copyOf(steps);
    }

    public String rawText() {
        return rawText;
    }

    public synchronized Optional<PlanStep> claimNextPending() {
        for (int i = 0; i < steps.size(); i++) {
            PlanStep step = steps.get(i);
            if (step.status() == PlanStepStatus.PENDING) {
                PlanStep claimed = step.withStatus(PlanStepStatus.IN_PROGRESS);
                steps.set(i, claimed);
                return Optional.of(claimed);
            }
        }
        return Optional.empty();
    }

    public synchronized Optional<PlanStep> update(int stepId, PlanStepStatus status) {
        for (int i = 0; i < steps.size(); i++) {
            PlanStep step = steps.get(i);
            if (step.id() == stepId) {
                PlanStep updated = step.withStatus(status);
                steps.set(i, updated);
                return Optional.of(updated);
            }
        }
        return Optional.empty();
    }

    public synchronized Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("steps", steps.stream().map(PlanStep::toMap).toList());
        map.put("raw_text", rawText);
        return map;
    }
}
