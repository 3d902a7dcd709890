package com.linlay.analysisagent.llm;

import com.linlay.analysisagent.llm.model.ToolCall;
import com.linlay.analysisagent.llm.model.ToolCallDelta;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ToolCallAccumulatorTest {

    @Test
    void shouldMatchSingleChunkDeliveryWhenFragmented() {
        ToolCallAccumulator fragmented = new ToolCallAccumulator();
        fragmented.accept(new ToolCallDelta("call_1", 0, null, "run_", "{\"co"));
        fragmented.accept(new ToolCallDelta(null, 0, null, "code", "de\": \"x"));
        fragmented.accept(new ToolCallDelta(null, 0, null, null, " = 1\"}"));

        ToolCallAccumulator whole = new ToolCallAccumulator();
        whole.accept(new ToolCallDelta("call_1", 0, null, "run_code", "{\"code\": \"x = 1\"}"));

        assertThat(fragmented.drain()).isEqualTo(whole.drain());
    }

    @Test
    void shouldKeepParallelCallsOrderedByIndex() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();
        accumulator.accept(new ToolCallDelta("b", 1, null, "run_r_code", "{}"));
        accumulator.accept(new ToolCallDelta("a", 0, null, "run_code", "{}"));

        List<ToolCall> calls = accumulator.drain();

        assertThat(calls).extracting(ToolCall::id).containsExactly("a", "b");
        assertThat(accumulator.hasPending()).isFalse();
    }

    @Test
    void shouldResolveMissingIndexById() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();
        accumulator.accept(new ToolCallDelta("a", null, "run_code", "{\"x\":"));
        accumulator.accept(new ToolCallDelta("b", null, "generate_report", "{}"));
        accumulator.accept(new ToolCallDelta("a", null, null, "1}"));

        List<ToolCall> calls = accumulator.drain();

        assertThat(calls).hasSize(2);
        assertThat(calls.get(0).arguments()).isEqualTo("{\"x\":1}");
        assertThat(calls.get(1).name()).isEqualTo("generate_report");
    }

    @Test
    void shouldNotDuplicateRepeatedFullName() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();
        accumulator.accept(new ToolCallDelta("a", 0, null, "run_code", "{"));
        accumulator.accept(new ToolCallDelta(null, 0, null, "run_code", "}"));

        assertThat(accumulator.drain().get(0).name()).isEqualTo("run_code");
    }
}
