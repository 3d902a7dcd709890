package com.linlay.analysisagent.llm;

import com.linlay.analysisagent.config.ConfigurationException;

public class NoAvailableProviderException extends ConfigurationException {

    public NoAvailableProviderException(String message) {
        super(message);
    }

    public NoAvailableProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
