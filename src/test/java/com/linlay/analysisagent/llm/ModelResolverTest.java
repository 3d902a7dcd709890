package com.linlay.analysisagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.config.AgentProviderProperties;
import com.linlay.analysisagent.llm.model.ChatMessage;
import com.linlay.analysisagent.llm.model.ChatRequest;
import com.linlay.analysisagent.llm.model.LlmChunk;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelResolverTest {

    @Test
    void shouldFailOverToNextProviderWhenFirstFailsBeforeOutput() {
        AtomicInteger secondCalls = new AtomicInteger();
        ProviderClient failing = client("first", true, request -> Flux.error(new ProviderException("first", "HTTP 503")));
        ProviderClient healthy = client("second", true, request -> {
            secondCalls.incrementAndGet();
            return Flux.just(LlmChunk.text("ok"));
        });
        ModelResolver resolver = new ModelResolver(List.of(failing, healthy));

        List<LlmChunk> chunks = resolver.chat(List.of(ChatMessage.user("hi")), List.of()).collectList().block();

        assertThat(chunks).extracting(LlmChunk::text).containsExactly("ok");
        assertThat(secondCalls.get()).isEqualTo(1);
    }

    @Test
    void shouldSkipUnavailableProviders() {
        AtomicInteger skippedCalls = new AtomicInteger();
        ProviderClient unavailable = client("off", false, request -> {
            skippedCalls.incrementAndGet();
            return Flux.just(LlmChunk.text("never"));
        });
        ProviderClient healthy = client("on", true, request -> Flux.just(LlmChunk.text("ok")));
        ModelResolver resolver = new ModelResolver(List.of(unavailable, healthy));

        List<LlmChunk> chunks = resolver.chat(List.of(ChatMessage.user("hi")), List.of()).collectList().block();

        assertThat(chunks).extracting(LlmChunk::text).containsExactly("ok");
        assertThat(skippedCalls.get()).isZero();
    }

    @Test
    void shouldNotFailOverAfterOutputWasEmitted() {
        AtomicInteger secondCalls = new AtomicInteger();
        ProviderClient broken = client("first", true, request -> Flux.concat(
                Flux.just(LlmChunk.text("partial")),
                Flux.error(new ProviderException("first", "connection reset"))
        ));
        ProviderClient healthy = client("second", true, request -> {
            secondCalls.incrementAndGet();
            return Flux.just(LlmChunk.text("ok"));
        });
        ModelResolver resolver = new ModelResolver(List.of(broken, healthy));

        assertThatThrownBy(() -> resolver.chat(List.of(ChatMessage.user("hi")), List.of()).collectList().block())
                .hasMessageContaining("connection reset");
        assertThat(secondCalls.get()).isZero();
    }

    @Test
    void shouldRaiseNoAvailableProviderWhenAllFail() {
        ProviderClient failing = client("only", true, request -> Flux.error(new ProviderException("only", "HTTP 401")));
        ModelResolver resolver = new ModelResolver(List.of(failing));

        assertThatThrownBy(() -> resolver.chat(List.of(ChatMessage.user("hi")), List.of()).blockLast())
                .isInstanceOf(NoAvailableProviderException.class)
                .hasMessageContaining("All LLM providers failed");
    }

    @Test
    void shouldRaiseNoAvailableProviderWhenNothingConfigured() {
        ModelResolver resolver = new ModelResolver(List.of());

        assertThatThrownBy(() -> resolver.chat(List.of(ChatMessage.user("hi")), List.of()).blockLast())
                .isInstanceOf(NoAvailableProviderException.class);
    }

    @Test
    void shouldTryPreferredProviderFirst() {
        ProviderClient first = client("first", true, request -> Flux.just(LlmChunk.text("from first")));
        ProviderClient second = client("second", true, request -> Flux.just(LlmChunk.text("from second")));
        ModelResolver resolver = new ModelResolver(List.of(first, second));

        resolver.setPreferredProvider("SECOND", null);

        StepVerifier.create(resolver.chat(List.of(ChatMessage.user("hi")), List.of()).map(LlmChunk::text))
                .expectNext("from second")
                .verifyComplete();
        assertThat(resolver.activeModelInfo()).containsEntry("provider_id", "second");

        resolver.setPreferredProvider(" ", null);
        assertThat(resolver.preferredProvider()).isNull();
        assertThat(resolver.activeModelInfo()).containsEntry("provider_id", "first");
    }

    @Test
    void shouldReportNoAvailableModel() {
        ModelResolver resolver = new ModelResolver(List.of(client("off", false, request -> Flux.empty())));

        assertThat(resolver.activeModelInfo())
                .containsEntry("provider_id", "")
                .containsEntry("provider_name", "no available model");
    }

    @Test
    void shouldStoreAndClearPurposeOverrides() {
        ModelResolver resolver = new ModelResolver(List.of());

        resolver.setPreferredProvider("deepseek", "title_generation");
        assertThat(resolver.purposeOverrides()).containsKey("title_generation");
        assertThat(resolver.purposeOverrides().get("title_generation").providerId()).isEqualTo("deepseek");

        resolver.setPreferredProvider(null, "title_generation");
        assertThat(resolver.purposeOverrides()).isEmpty();
    }

    @Test
    void shouldFoldStreamIntoResponse() {
        ProviderClient healthy = client("only", true, request -> Flux.just(
                LlmChunk.text("Hel"), LlmChunk.text("lo"), LlmChunk.finish("stop")));
        ModelResolver resolver = new ModelResolver(List.of(healthy));

        StepVerifier.create(resolver.chatComplete(List.of(ChatMessage.user("hi")), List.of(), null, null, null))
                .assertNext(response -> assertThat(response.text()).isEqualTo("Hello"))
                .verifyComplete();
    }

    @Test
    void shouldRebuildClientsOnReload() {
        ProviderClientFactory factory = new ProviderClientFactory(new ObjectMapper(), new LlmCallLogger(), Duration.ofSeconds(5));
        ProviderClient initial = client("initial", true, request -> Flux.empty());
        ModelResolver resolver = new ModelResolver(List.of(initial), factory);
        AgentProviderProperties.ProviderConfig enabled = new AgentProviderProperties.ProviderConfig();
        enabled.setApiKey("sk-test");
        enabled.setModel("deepseek-chat");
        AgentProviderProperties.ProviderConfig disabled = new AgentProviderProperties.ProviderConfig();
        disabled.setEnabled(false);
        Map<String, AgentProviderProperties.ProviderConfig> configs = new LinkedHashMap<>();
        configs.put("deepseek", enabled);
        configs.put("openai", disabled);

        resolver.reload(configs, Map.of());

        assertThat(resolver.clients()).extracting(ProviderClient::providerId).containsExactly("deepseek");
        assertThat(resolver.activeModelInfo()).containsEntry("model", "deepseek-chat");
        resolver.clients().forEach(ProviderClient::close);
    }

    @Test
    void shouldRejectReloadWithoutFactory() {
        ModelResolver resolver = new ModelResolver(List.of());

        assertThatThrownBy(() -> resolver.reload(Map.of(), Map.of())).isInstanceOf(IllegalStateException.class);
    }

    private static ProviderClient client(String id, boolean available, Function<ChatRequest, Flux<LlmChunk>> stream) {
        return new ProviderClient() {
            @Override
            public String providerId() {
                return id;
            }

            @Override
            public String displayName() {
                return id;
            }

            @Override
            public String model() {
                return "test-model";
            }

            @Override
            public boolean isAvailable() {
                return available;
            }

            @Override
            public Flux<LlmChunk> streamChat(ChatRequest request) {
                return stream.apply(request);
            }
        };
    }
}
