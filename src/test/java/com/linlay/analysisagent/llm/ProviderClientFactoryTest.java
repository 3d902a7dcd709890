package com.linlay.analysisagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.config.AgentProviderProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderClientFactoryTest {

    private final ProviderClientFactory factory =
            new ProviderClientFactory(new ObjectMapper(), new LlmCallLogger(), Duration.ofSeconds(5));

    @Test
    void shouldFillDefaultsFromKnownProvider() {
        AgentProviderProperties.ProviderConfig config = new AgentProviderProperties.ProviderConfig();
        config.setApiKey("sk-test");
        config.setModel("deepseek-chat");

        ProviderSettings settings = factory.resolveSettings(" DeepSeek ", config);

        assertThat(settings.providerId()).isEqualTo("deepseek");
        assertThat(settings.displayName()).isEqualTo("DeepSeek");
        assertThat(settings.protocol()).isEqualTo(ProviderProtocol.OPENAI_COMPATIBLE);
        assertThat(settings.baseUrl()).isEqualTo("https://api.deepseek.com/v1");
        assertThat(settings.streamUsage()).isTrue();
        assertThat(settings.requiresApiKey()).isTrue();
    }

    @Test
    void shouldLetConfigurationOverrideCatalog() {
        AgentProviderProperties.ProviderConfig config = new AgentProviderProperties.ProviderConfig();
        config.setBaseUrl(" https://proxy.example.com/v1 ");
        config.setDisplayName("Proxy");
        config.setStreamUsage(false);

        ProviderSettings settings = factory.resolveSettings("openai", config);

        assertThat(settings.baseUrl()).isEqualTo("https://proxy.example.com/v1");
        assertThat(settings.displayName()).isEqualTo("Proxy");
        assertThat(settings.streamUsage()).isFalse();
    }

    @Test
    void shouldNormalizeOllamaBaseUrl() {
        AgentProviderProperties.ProviderConfig config = new AgentProviderProperties.ProviderConfig();
        config.setBaseUrl("http://gpu-box:11434//");
        config.setModel("qwen2.5");

        ProviderSettings settings = factory.resolveSettings("ollama", config);

        assertThat(settings.baseUrl()).isEqualTo("http://gpu-box:11434/v1");
        assertThat(settings.requiresApiKey()).isFalse();
        assertThat(settings.isAvailable()).isTrue();
    }

    @Test
    void shouldTreatUnknownProvidersAsOpenAiCompatible() {
        ProviderSettings settings = factory.resolveSettings("my-gateway", null);

        assertThat(settings.protocol()).isEqualTo(ProviderProtocol.OPENAI_COMPATIBLE);
        assertThat(settings.displayName()).isEqualTo("my-gateway");
        assertThat(settings.baseUrl()).isNull();
        assertThat(settings.isAvailable()).isFalse();
        assertThatThrownBy(() -> factory.resolveSettings(" ", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldAddCatalogHeadersAndLetConfigurationOverrideThem() {
        AgentProviderProperties.ProviderConfig config = new AgentProviderProperties.ProviderConfig();
        config.setHeaders(Map.of("X-Trace", "on"));

        ProviderSettings kimi = factory.resolveSettings("kimi_coding", config);

        assertThat(kimi.headers())
                .containsEntry("User-Agent", KnownProvider.KIMI_CODING_USER_AGENT)
                .containsEntry("X-Trace", "on");

        config.setHeaders(Map.of("User-Agent", "custom/2"));
        assertThat(factory.resolveSettings("kimi_coding", config).headers()).containsEntry("User-Agent", "custom/2");
        assertThat(factory.resolveSettings("openai", null).headers()).isEmpty();
    }

    @Test
    void shouldTreatStreamsAsIncrementalUnlessConfiguredCumulative() {
        AgentProviderProperties.ProviderConfig config = new AgentProviderProperties.ProviderConfig();

        assertThat(factory.resolveSettings("deepseek", config).cumulativeText()).isFalse();

        config.setCumulativeText(true);
        ProviderSettings gateway = factory.resolveSettings("my-gateway", config);

        assertThat(gateway.cumulativeText()).isTrue();
        assertThat(gateway.withOverrides("other-model", null).cumulativeText()).isTrue();
        assertThat(config.copy().isCumulativeText()).isTrue();
    }

    @Test
    void shouldCreateClientForProtocol() {
        AgentProviderProperties.ProviderConfig config = new AgentProviderProperties.ProviderConfig();
        config.setApiKey("sk-ant");
        config.setModel("claude-sonnet");

        try (ProviderClient anthropic = factory.create("anthropic", config);
             ProviderClient oneShot = factory.createOneShot("openai", config, "gpt-4o-mini", null)) {
            assertThat(anthropic).isInstanceOf(AnthropicClient.class);
            assertThat(anthropic.model()).isEqualTo("claude-sonnet");
            assertThat(oneShot).isInstanceOf(OpenAiCompatibleClient.class);
            assertThat(oneShot.model()).isEqualTo("gpt-4o-mini");
            assertThat(oneShot.isAvailable()).isTrue();
        }
    }
}
