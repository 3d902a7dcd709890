package com.linlay.analysisagent.llm.adapter.anthropic;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.llm.ProviderException;
import com.linlay.analysisagent.llm.model.LlmDelta;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnthropicSseDeltaParserTest {

    private final AnthropicSseDeltaParser parser = new AnthropicSseDeltaParser(new ObjectMapper(), "anthropic");

    @Test
    void shouldMapToolUseBlocksToToolCallDeltas() {
        LlmDelta start = parser.parseOrNull("""
                data: {"type":"content_block_start","index":1,"content_block":{"type":"tool_use","id":"toolu_1","name":"run_code","input":{}}}
                """);
        LlmDelta args = parser.parseOrNull("""
                data: {"type":"content_block_delta","index":1,"delta":{"type":"input_json_delta","partial_json":"{\\"code\\":"}}
                """);

        assertThat(start.toolCalls()).hasSize(1);
        assertThat(start.toolCalls().get(0).id()).isEqualTo("toolu_1");
        assertThat(start.toolCalls().get(0).index()).isEqualTo(1);
        assertThat(start.toolCalls().get(0).name()).isEqualTo("run_code");
        assertThat(args.toolCalls().get(0).index()).isEqualTo(1);
        assertThat(args.toolCalls().get(0).arguments()).isEqualTo("{\"code\":");
    }

    @Test
    void shouldSplitTextAndThinkingDeltas() {
        LlmDelta text = parser.parseOrNull("{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"你好\"}}");
        LlmDelta thinking = parser.parseOrNull("{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"thinking_delta\",\"thinking\":\"先看数据\"}}");

        assertThat(text.content()).isEqualTo("你好");
        assertThat(thinking.reasoning()).isEqualTo("先看数据");
    }

    @Test
    void shouldNormalizeStopReasonAndUsage() {
        LlmDelta delta = parser.parseOrNull("{\"type\":\"message_delta\",\"delta\":{\"stop_reason\":\"tool_use\"},\"usage\":{\"output_tokens\":42}}");

        assertThat(delta.finishReason()).isEqualTo("tool_calls");
        assertThat(delta.usage()).containsEntry("output_tokens", 42L);
        assertThat(AnthropicSseDeltaParser.normalizeStopReason("end_turn")).isEqualTo("stop");
        assertThat(AnthropicSseDeltaParser.normalizeStopReason("max_tokens")).isEqualTo("length");
    }

    @Test
    void shouldRaiseProviderExceptionOnErrorEvent() {
        assertThatThrownBy(() -> parser.parseOrNull("{\"type\":\"error\",\"error\":{\"message\":\"overloaded\"}}"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("overloaded");
    }

    @Test
    void shouldIgnorePingAndNonJsonLines() {
        assertThat(parser.parseOrNull("{\"type\":\"ping\"}")).isNull();
        assertThat(parser.parseOrNull("event: message_start")).isNull();
    }
}
