package com.linlay.analysisagent.llm;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in provider catalog. Configured values override these defaults.
 */
public enum KnownProvider {

    OPENAI("openai", "OpenAI", ProviderProtocol.OPENAI_COMPATIBLE, "https://api.openai.com/v1", true, true),
    ANTHROPIC("anthropic", "Anthropic Claude", ProviderProtocol.ANTHROPIC, "https://api.anthropic.com", true, true),
    MOONSHOT("moonshot", "Moonshot AI (Kimi)", ProviderProtocol.OPENAI_COMPATIBLE, "https://api.moonshot.cn/v1", false, true),
    KIMI_CODING("kimi_coding", "Kimi Coding", ProviderProtocol.OPENAI_COMPATIBLE, "https://api.kimi.com/coding/v1", false, true),
    ZHIPU("zhipu", "Zhipu AI (GLM)", ProviderProtocol.OPENAI_COMPATIBLE, "https://open.bigmodel.cn/api/coding/paas/v4", false, true),
    DEEPSEEK("deepseek", "DeepSeek", ProviderProtocol.OPENAI_COMPATIBLE, "https://api.deepseek.com/v1", true, true),
    DASHSCOPE("dashscope", "DashScope (Qwen)", ProviderProtocol.OPENAI_COMPATIBLE, "https://dashscope.aliyuncs.com/compatible-mode/v1", true, true),
    OLLAMA("ollama", "Ollama (local)", ProviderProtocol.OPENAI_COMPATIBLE, "http://localhost:11434/v1", false, false);

    static final String KIMI_CODING_USER_AGENT = "ClaudeCode/1.0.0";

    private final String id;
    private final String displayName;
    private final ProviderProtocol protocol;
    private final String defaultBaseUrl;
    private final boolean streamUsage;
    private final boolean requiresApiKey;

    KnownProvider(String id, String displayName, ProviderProtocol protocol, String defaultBaseUrl,
                  boolean streamUsage, boolean requiresApiKey) {
        this.id = id;
        this.displayName = displayName;
        this.protocol = protocol;
        this.defaultBaseUrl = defaultBaseUrl;
        this.streamUsage = streamUsage;
        this.requiresApiKey = requiresApiKey;
    }

    public static Optional<KnownProvider> find(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            return Optional.empty();
        }
        String normalized = providerId.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(provider -> provider.id.equals(normalized)).findFirst();
    }

    // kimi k2.5 models only accept temperature=1
    public double adjustTemperature(String model, double requested) {
        if (this == MOONSHOT && model != null && model.contains("k2.5")) {
            return 1.0;
        }
        return requested;
    }

    // Kimi Coding allowlists coding clients by User-Agent
    public Map<String, String> defaultHeaders() {
        if (this == KIMI_CODING) {
            return Map.of("User-Agent", KIMI_CODING_USER_AGENT);
        }
        return Map.of();
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public ProviderProtocol protocol() {
        return protocol;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    public boolean streamUsage() {
        return streamUsage;
    }

    public boolean requiresApiKey() {
        return requiresApiKey;
    }
}
