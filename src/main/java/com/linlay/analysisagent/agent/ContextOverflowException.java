package com.linlay.analysisagent.agent;

public class ContextOverflowException extends RuntimeException {

    public ContextOverflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
