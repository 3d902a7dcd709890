package com.linlay.analysisagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.llm.interaction-log")
public class LlmInteractionLogProperties {

    private boolean enabled = true;
    private boolean maskSensitive = true;
    private int maxLoggedChars = 4000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isMaskSensitive() {
        return maskSensitive;
    }

    public void setMaskSensitive(boolean maskSensitive) {
        this.maskSensitive = maskSensitive;
    }

    public int getMaxLoggedChars() {
        return maxLoggedChars;
    }

    public void setMaxLoggedChars(int maxLoggedChars) {
        this.maxLoggedChars = maxLoggedChars;
    }
}
