package com.linlay.analysisagent.agent.context;

import com.linlay.analysisagent.llm.ProviderException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PatternContextOverflowClassifierTest {

    private final PatternContextOverflowClassifier classifier = new PatternContextOverflowClassifier();

    @Test
    void shouldDetectOverflowInCauseChain() {
        RuntimeException wrapped = new RuntimeException("stream failed",
                new ProviderException("openai", "This model's Maximum Context Length is 8192 tokens"));

        assertThat(classifier.isContextOverflow(wrapped)).isTrue();
        assertThat(classifier.isContextOverflow(new IllegalStateException("请求超出上下文限制"))).isTrue();
    }

    @Test
    void shouldIgnoreUnrelatedErrors() {
        assertThat(classifier.isContextOverflow(new RuntimeException("rate limited"))).isFalse();
        assertThat(classifier.isContextOverflow(new RuntimeException((String) null))).isFalse();
        assertThat(classifier.isContextOverflow(null)).isFalse();
    }

    @Test
    void shouldUseCustomPatterns() {
        PatternContextOverflowClassifier custom = new PatternContextOverflowClassifier(List.of("  ", "BUDGET EXHAUSTED"));

        assertThat(custom.isContextOverflow(new RuntimeException("budget exhausted for prompt"))).isTrue();
        assertThat(custom.isContextOverflow(new RuntimeException("context window exceeded"))).isFalse();
    }
}
