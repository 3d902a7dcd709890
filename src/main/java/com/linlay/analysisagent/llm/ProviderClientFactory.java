package com.linlay.analysisagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.config.AgentProviderProperties;
import com.linlay.analysisagent.config.LlmInteractionLogProperties;
import com.linlay.analysisagent.config.LlmProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
public class ProviderClientFactory {

    private final ObjectMapper objectMapper;
    private final LlmCallLogger callLogger;
    private final Duration streamTimeout;

    @Autowired
    public ProviderClientFactory(
            ObjectMapper objectMapper,
            LlmProperties llmProperties,
            LlmInteractionLogProperties logProperties
    ) {
        this(objectMapper, new LlmCallLogger(logProperties), Duration.ofMillis(llmProperties.getStreamTimeoutMs()));
    }

    public ProviderClientFactory(ObjectMapper objectMapper, LlmCallLogger callLogger, Duration streamTimeout) {
        this.objectMapper = objectMapper;
        this.callLogger = callLogger;
        this.streamTimeout = streamTimeout;
    }

    public ProviderClient create(String providerId, AgentProviderProperties.ProviderConfig config) {
        ProviderSettings settings = resolveSettings(providerId, config);
        return create(settings);
    }

    // the caller closes one-shot clients
    public ProviderClient createOneShot(
            String providerId,
            AgentProviderProperties.ProviderConfig baseConfig,
            String modelOverride,
            String baseUrlOverride
    ) {
        ProviderSettings settings = resolveSettings(providerId, baseConfig).withOverrides(modelOverride, baseUrlOverride);
        return create(settings);
    }

    public ProviderSettings resolveSettings(String providerId, AgentProviderProperties.ProviderConfig config) {
        if (!StringUtils.hasText(providerId)) {
            throw new IllegalArgumentException("Provider id must not be blank");
        }
        String normalizedId = providerId.trim().toLowerCase(Locale.ROOT);
        AgentProviderProperties.ProviderConfig safeConfig = config == null
                ? new AgentProviderProperties.ProviderConfig()
                : config;
        Optional<KnownProvider> known = KnownProvider.find(normalizedId);

        ProviderProtocol protocol = safeConfig.getProtocol() != null
                ? safeConfig.getProtocol()
                : known.map(KnownProvider::protocol).orElse(ProviderProtocol.OPENAI_COMPATIBLE);
        String baseUrl = StringUtils.hasText(safeConfig.getBaseUrl())
                ? safeConfig.getBaseUrl().trim()
                : known.map(KnownProvider::defaultBaseUrl).orElse(null);
        if (known.filter(provider -> provider == KnownProvider.OLLAMA).isPresent()) {
            baseUrl = ollamaBaseUrl(baseUrl);
        }
        return new ProviderSettings(
                normalizedId,
                StringUtils.hasText(safeConfig.getDisplayName())
                        ? safeConfig.getDisplayName()
                        : known.map(KnownProvider::displayName).orElse(normalizedId),
                protocol,
                baseUrl,
                safeConfig.getApiKey(),
                safeConfig.getModel(),
                safeConfig.getStreamUsage() != null
                        ? safeConfig.getStreamUsage()
                        : known.map(KnownProvider::streamUsage).orElse(true),
                known.map(KnownProvider::requiresApiKey).orElse(true),
                safeConfig.getFixedTemperature(),
                mergeHeaders(known.map(KnownProvider::defaultHeaders).orElse(Map.of()), safeConfig.getHeaders()),
                safeConfig.isCumulativeText()
        );
    }

    private static Map<String, String> mergeHeaders(Map<String, String> defaults, Map<String, String> configured) {
        Map<String, String> merged = new LinkedHashMap<>(defaults);
        if (configured != null) {
            merged.putAll(configured);
        }
        return merged;
    }

    private ProviderClient create(ProviderSettings settings) {
        return switch (settings.protocol()) {
            case ANTHROPIC -> new AnthropicClient(settings, objectMapper, callLogger, streamTimeout);
            case OPENAI_COMPATIBLE -> new OpenAiCompatibleClient(settings, objectMapper, callLogger, streamTimeout);
        };
    }

    private String ollamaBaseUrl(String baseUrl) {
        if (!StringUtils.hasText(baseUrl)) {
            return null;
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.endsWith("/v1") ? trimmed : trimmed + "/v1";
    }
}
