package com.linlay.analysisagent.llm;

import org.springframework.http.HttpHeaders;

import java.util.Set;
import java.util.regex.Pattern;

public final class LlmLogSanitizer {

    static final String MASK = "***";

    private static final Set<String> SECRET_HEADERS = Set.of("authorization", "x-api-key", "api-key", "x-access-token");

    // JSON fields like "api_key": "...", only the value is replaced
    private static final Pattern SECRET_FIELD = Pattern.compile(
            "(?i)(\"(?:authorization|x-api-key|api[_-]?key|(?:access|refresh)[_-]?token|token|secret|password)\"\\s*:\\s*)\"[^\"]*\""
    );
    private static final Pattern BEARER = Pattern.compile("(?i)(Bearer\\s+)[\\w.\\-+/=]+");

    private LlmLogSanitizer() {
    }

    public static HttpHeaders maskHeaders(HttpHeaders headers, boolean maskSensitive) {
        HttpHeaders copy = new HttpHeaders();
        if (headers == null) {
            return copy;
        }
        headers.forEach((name, values) -> {
            if (maskSensitive && SECRET_HEADERS.contains(name.toLowerCase())) {
                copy.set(name, MASK);
            } else {
                copy.put(name, values);
            }
        });
        return copy;
    }

    public static String maskText(String text, boolean maskSensitive) {
        if (text == null) {
            return "";
        }
        if (!maskSensitive || text.isEmpty()) {
            return text;
        }
        String withoutFields = SECRET_FIELD.matcher(text).replaceAll("$1\"" + MASK + "\"");
        return BEARER.matcher(withoutFields).replaceAll("$1" + MASK);
    }

    public static String maskApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return "";
        }
        String key = apiKey.trim();
        return key.length() <= 4 ? MASK : key.substring(0, 4) + MASK;
    }

    // maxChars <= 0 disables truncation
    public static String truncate(String text, int maxChars) {
        if (text == null || maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "...(" + (text.length() - maxChars) + " more chars)";
    }
}
