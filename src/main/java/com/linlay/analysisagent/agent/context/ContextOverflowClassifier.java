package com.linlay.analysisagent.agent.context;

@FunctionalInterface
public interface ContextOverflowClassifier {

    boolean isContextOverflow(Throwable error);
}
