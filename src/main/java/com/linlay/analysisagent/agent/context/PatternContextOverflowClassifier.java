package com.linlay.analysisagent.agent.context;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class PatternContextOverflowClassifier implements ContextOverflowClassifier {

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "maximum context length",
            "context length",
            "context window",
            "too many tokens",
            "token limit",
            "prompt is too long",
            "exceeds the context",
            "input is too long",
            "上下文长度",
            "超出上下文",
            "超过最大 token",
            "超过最大token"
    );

    private final List<String> patterns;

    public PatternContextOverflowClassifier() {
        this(DEFAULT_PATTERNS);
    }

    public PatternContextOverflowClassifier(List<String> patterns) {
        this.patterns = patterns == null ? List.of() : patterns.stream()
                .filter(pattern -> pattern != null && !pattern.isBlank())
                .map(pattern -> pattern.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public boolean isContextOverflow(Throwable error) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = error;
        while (current != null && visited.add(current)) {
            String message = current.getMessage();
            if (message != null && matches(message)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private boolean matches(String message) {
        String text = message.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (text.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
