package com.linlay.analysisagent.llm;

import org.springframework.util.StringUtils;

public record PurposeOverride(String providerId, String model, String baseUrl) {

    public PurposeOverride {
        providerId = StringUtils.hasText(providerId) ? providerId.trim() : null;
        model = StringUtils.hasText(model) ? model.trim() : null;
        baseUrl = StringUtils.hasText(baseUrl) ? baseUrl.trim() : null;
    }

    public static PurposeOverride provider(String providerId) {
        return new PurposeOverride(providerId, null, null);
    }

    public boolean namesProvider() {
        return providerId != null;
    }
}
