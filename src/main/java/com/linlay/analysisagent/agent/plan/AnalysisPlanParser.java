package com.linlay.analysisagent.agent.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// numbered steps such as "1. Descriptive stats - Tool: run_code"
public final class AnalysisPlanParser {

    private static final int MIN_STEPS = 2;

    private static final Pattern STEP_LINE = Pattern.compile(
            "^\\s*(\\d+)\\.\\s+(.+?)(?:\\s*[-—–]\\s*(?:使用工具|Tool)[:：]\\s*(\\w+))?\\s*$",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern TRAILING_DASH = Pattern.compile("[\\s\\-—–]+$");

    private AnalysisPlanParser() {
    }

    public static Optional<AnalysisPlan> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        List<PlanStep> steps = new ArrayList<>();
        for (String line : text.split("\\R")) {
            Matcher matcher = STEP_LINE.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            String title = TRAILING_DASH.matcher(matcher.group(2).trim()).replaceAll("");
            if (title.isEmpty()) {
                continue;
            }
            int id;
            try {
                id = Integer.parseInt(matcher.group(1));
            } catch (NumberFormatException ex) {
                continue;
            }
            steps.add(new PlanStep(id, title, matcher.group(3), PlanStepStatus.PENDING));
        }
        if (steps.size() < MIN_STEPS) {
            return Optional.empty();
        }
        return Optional.of(new AnalysisPlan(steps, text.trim()));
    }
}
