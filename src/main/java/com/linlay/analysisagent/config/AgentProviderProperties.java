package com.linlay.analysisagent.config;

import com.linlay.analysisagent.llm.ProviderProtocol;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

// map order is the failover order
@Validated
@ConfigurationProperties(prefix = "agent")
public class AgentProviderProperties {

    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();

    public Map<String, ProviderConfig> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderConfig> providers) {
        this.providers = providers == null ? new LinkedHashMap<>() : providers;
    }

    public ProviderConfig getProvider(String key) {
        return providers.get(key);
    }

    public static class ProviderConfig {
        private ProviderProtocol protocol;
        private String displayName;
        private String baseUrl;
        private String apiKey;
        private String model;
        private Boolean streamUsage;
        private Double fixedTemperature;
        private Map<String, String> headers = new LinkedHashMap<>();
        private boolean enabled = true;
        private boolean cumulativeText;

        public ProviderConfig copy() {
            ProviderConfig copy = new ProviderConfig();
            copy.setProtocol(protocol);
            copy.setDisplayName(displayName);
            copy.setBaseUrl(baseUrl);
            copy.setApiKey(apiKey);
            copy.setModel(model);
            copy.setStreamUsage(streamUsage);
            copy.setFixedTemperature(fixedTemperature);
            copy.setHeaders(new LinkedHashMap<>(headers));
            copy.setEnabled(enabled);
            copy.setCumulativeText(cumulativeText);
            return copy;
        }

        public ProviderProtocol getProtocol() {
            return protocol;
        }

        public void setProtocol(ProviderProtocol protocol) {
            this.protocol = protocol;
        }

        public String getDisplayName() {
            return displayName;
        }

        public void setDisplayName(String displayName) {
            this.displayName = displayName;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Boolean getStreamUsage() {
            return streamUsage;
        }

        public void setStreamUsage(Boolean streamUsage) {
            this.streamUsage = streamUsage;
        }

        public Double getFixedTemperature() {
            return fixedTemperature;
        }

        public void setFixedTemperature(Double fixedTemperature) {
            this.fixedTemperature = fixedTemperature;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers == null ? new LinkedHashMap<>() : headers;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isCumulativeText() {
            return cumulativeText;
        }

        public void setCumulativeText(boolean cumulativeText) {
            this.cumulativeText = cumulativeText;
        }
    }
}
