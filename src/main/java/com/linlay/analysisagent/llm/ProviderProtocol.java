package com.linlay.analysisagent.llm;

public enum ProviderProtocol {
    OPENAI_COMPATIBLE,
    ANTHROPIC
}
