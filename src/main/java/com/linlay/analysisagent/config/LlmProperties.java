package com.linlay.analysisagent.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "agent.llm")
public class LlmProperties {

    private String preferredProvider;
    private double temperature = 0.3;
    @Min(1)
    private int maxTokens = 4096;
    @Min(1)
    private long streamTimeoutMs = 60_000L;
    private Map<String, Purpose> purposes = new LinkedHashMap<>();

    public String getPreferredProvider() {
        return preferredProvider;
    }

    public void setPreferredProvider(String preferredProvider) {
        this.preferredProvider = preferredProvider;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public long getStreamTimeoutMs() {
        return streamTimeoutMs;
    }

    public void setStreamTimeoutMs(long streamTimeoutMs) {
        this.streamTimeoutMs = streamTimeoutMs;
    }

    public Map<String, Purpose> getPurposes() {
        return purposes;
    }

    public void setPurposes(Map<String, Purpose> purposes) {
        this.purposes = purposes == null ? new LinkedHashMap<>() : purposes;
    }

    public static class Purpose {
        private String providerId;
        private String model;
        private String baseUrl;

        public String getProviderId() {
            return providerId;
        }

        public void setProviderId(String providerId) {
            this.providerId = providerId;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
