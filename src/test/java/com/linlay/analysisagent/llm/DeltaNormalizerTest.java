package com.linlay.analysisagent.llm;

import com.linlay.analysisagent.llm.model.LlmChunk;
import com.linlay.analysisagent.llm.model.LlmDelta;
import com.linlay.analysisagent.llm.model.ToolCall;
import com.linlay.analysisagent.llm.model.ToolCallDelta;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeltaNormalizerTest {

    @Test
    void shouldConvertCumulativeContentToIncrements() {
        DeltaNormalizer normalizer = new DeltaNormalizer(true);

        LlmChunk first = normalizer.apply(new LlmDelta("Hel", null, null));
        LlmChunk second = normalizer.apply(new LlmDelta("Hello", null, null));
        LlmChunk third = normalizer.apply(new LlmDelta("Hello world", null, null));

        assertThat(first.text()).isEqualTo("Hel");
        assertThat(second.text()).isEqualTo("lo");
        assertThat(third.text()).isEqualTo(" world");
    }

    @Test
    void shouldKeepIncrementalContentUnchanged() {
        DeltaNormalizer normalizer = new DeltaNormalizer();

        assertThat(normalizer.apply(new LlmDelta("ab", null, null)).text()).isEqualTo("ab");
        assertThat(normalizer.apply(new LlmDelta("cd", null, null)).text()).isEqualTo("cd");
        assertThat(normalizer.apply(new LlmDelta("ab", null, null)).text()).isEqualTo("ab");
    }

    @Test
    void shouldNotStripRepeatedFirstTokenFromIncrementalStream() {
        DeltaNormalizer normalizer = new DeltaNormalizer();

        StringBuilder text = new StringBuilder();
        for (String piece : List.of("1", "1", " items")) {
            text.append(normalizer.apply(new LlmDelta(piece, null, null)).text());
        }
        StringBuilder reasoning = new StringBuilder();
        for (String piece : List.of("*", "**bold", " text")) {
            reasoning.append(normalizer.apply(new LlmDelta(piece, null, null, null, null)).reasoning());
        }

        assertThat(text.toString()).isEqualTo("11 items");
        assertThat(reasoning.toString()).isEqualTo("***bold text");
    }

    @Test
    void shouldAccumulateToolCallFragmentsUntilToolCallsFinishReason() {
        DeltaNormalizer normalizer = new DeltaNormalizer();

        LlmChunk first = normalizer.apply(new LlmDelta(null, List.of(
                new ToolCallDelta("call_1", 0, "function", "run_", "{\"code\":")
        ), null));
        LlmChunk second = normalizer.apply(new LlmDelta(null, List.of(
                new ToolCallDelta(null, 0, null, "code", "\"print(1)\"}")
        ), null));
        LlmChunk finish = normalizer.apply(new LlmDelta(null, null, "tool_calls"));

        assertThat(first).isNull();
        assertThat(second).isNull();
        assertThat(finish.toolCalls()).hasSize(1);
        ToolCall call = finish.toolCalls().get(0);
        assertThat(call.id()).isEqualTo("call_1");
        assertThat(call.name()).isEqualTo("run_code");
        assertThat(call.arguments()).isEqualTo("{\"code\":\"print(1)\"}");
    }

    @Test
    void shouldCloseDanglingToolCallsOnComplete() {
        DeltaNormalizer normalizer = new DeltaNormalizer();
        normalizer.apply(new LlmDelta(null, List.of(
                new ToolCallDelta("call_9", 0, "function", "generate_report", "{}")
        ), "stop"));

        List<LlmChunk> rest = normalizer.complete();

        assertThat(rest).hasSize(1);
        assertThat(rest.get(0).toolCalls()).extracting(ToolCall::name).containsExactly("generate_report");
    }

    @Test
    void shouldSplitThinkTagsAndMergeUsage() {
        DeltaNormalizer normalizer = new DeltaNormalizer();

        LlmChunk chunk = normalizer.apply(new LlmDelta("<think>plan</think>answer", null, null));
        LlmChunk usage = normalizer.apply(new LlmDelta(null, null, null, null,
                Map.of("prompt_tokens", 12, "completion_tokens", "5")));

        assertThat(chunk.text()).isEqualTo("answer");
        assertThat(chunk.reasoning()).isEqualTo("plan");
        assertThat(usage.usage().inputTokens()).isEqualTo(12L);
        assertThat(usage.usage().outputTokens()).isEqualTo(5L);
    }
}
