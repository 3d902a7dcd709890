package com.linlay.analysisagent.sandbox;

public enum SandboxErrorKind {
    TIMEOUT,
    CRASH,
    POLICY,
    CODE,
    CONFIGURATION
}
