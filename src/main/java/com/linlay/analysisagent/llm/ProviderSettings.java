package com.linlay.analysisagent.llm;

import org.springframework.util.StringUtils;

import java.util.Map;

public record ProviderSettings(
        String providerId,
        String displayName,
        ProviderProtocol protocol,
        String baseUrl,
        String apiKey,
        String model,
        boolean streamUsage,
        boolean requiresApiKey,
        Double fixedTemperature,
        Map<String, String> headers,
        boolean cumulativeText
) {

    public ProviderSettings {
        protocol = protocol == null ? ProviderProtocol.OPENAI_COMPATIBLE : protocol;
        displayName = StringUtils.hasText(displayName) ? displayName : providerId;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public ProviderSettings(
            String providerId,
            String displayName,
            ProviderProtocol protocol,
            String baseUrl,
            String apiKey,
            String model,
            boolean streamUsage,
            boolean requiresApiKey,
            Double fixedTemperature,
            Map<String, String> headers
    ) {
        this(providerId, displayName, protocol, baseUrl, apiKey, model, streamUsage, requiresApiKey,
                fixedTemperature, headers, false);
    }

    public boolean isAvailable() {
        if (!StringUtils.hasText(model)) {
            return false;
        }
        return requiresApiKey ? StringUtils.hasText(apiKey) : StringUtils.hasText(baseUrl);
    }

    public double resolveTemperature(double requested) {
        if (fixedTemperature != null) {
            return fixedTemperature;
        }
        return KnownProvider.find(providerId)
                .map(provider -> provider.adjustTemperature(model, requested))
                .orElse(requested);
    }

    public ProviderSettings withOverrides(String modelOverride, String baseUrlOverride) {
        return new ProviderSettings(
                providerId,
                displayName,
                protocol,
                StringUtils.hasText(baseUrlOverride) ? baseUrlOverride.trim() : baseUrl,
                apiKey,
                StringUtils.hasText(modelOverride) ? modelOverride.trim() : model,
                streamUsage,
                requiresApiKey,
                fixedTemperature,
                headers,
                cumulativeText
        );
    }
}
