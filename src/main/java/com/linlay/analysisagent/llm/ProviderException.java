package com.linlay.analysisagent.llm;

public class ProviderException extends RuntimeException {

    private final String providerId;

    public ProviderException(String providerId, String message) {
        super(message);
        this.providerId = providerId;
    }

    public ProviderException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    public String providerId() {
        return providerId;
    }
}
