package com.linlay.analysisagent.sandbox;

/**
 * Runs model-generated code in isolation. Implementations never throw; every failure is a {@link SandboxResult}.
 */
public interface CodeSandbox {

    String language();

    SandboxResult execute(SandboxRequest request);
}
