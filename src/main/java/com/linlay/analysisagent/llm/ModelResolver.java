package com.linlay.analysisagent.llm;

import com.linlay.analysisagent.config.AgentProviderProperties;
import com.linlay.analysisagent.config.LlmProperties;
import com.linlay.analysisagent.llm.model.ChatMessage;
import com.linlay.analysisagent.llm.model.ChatRequest;
import com.linlay.analysisagent.llm.model.LlmChunk;
import com.linlay.analysisagent.llm.model.LlmFunctionTool;
import com.linlay.analysisagent.llm.model.LlmResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes model calls along a provider failover chain.
 * <p>
 * A purpose override goes first, then the preferred provider, then configuration order. Once a provider
 * has emitted a chunk, a later failure ends the stream with an error instead of failing over.
 */
@Service
public class ModelResolver {

    private static final Logger log = LoggerFactory.getLogger(ModelResolver.class);

    private final ProviderClientFactory clientFactory;
    private final double defaultTemperature;
    private final int defaultMaxTokens;

    private final Object reloadLock = new Object();
    private volatile Snapshot snapshot;

    @Autowired
    public ModelResolver(
            ProviderClientFactory clientFactory,
            AgentProviderProperties providerProperties,
            LlmProperties llmProperties
    ) {
        this.clientFactory = clientFactory;
        this.defaultTemperature = llmProperties.getTemperature();
        this.defaultMaxTokens = llmProperties.getMaxTokens();
        this.snapshot = new Snapshot(List.of(), Map.of(), null, Map.of());
        reload(providerProperties.getProviders(), toPurposeOverrides(llmProperties.getPurposes()));
        setPreferredProvider(llmProperties.getPreferredProvider(), null);
    }

    public ModelResolver(List<ProviderClient> clients) {
        this(clients, null);
    }

    public ModelResolver(List<ProviderClient> clients, ProviderClientFactory clientFactory) {
        this.clientFactory = clientFactory;
        this.defaultTemperature = 0.3;
        this.defaultMaxTokens = 4096;
        this.snapshot = new Snapshot(List.copyOf(clients), Map.of(), null, Map.of());
    }

    public Flux<LlmChunk> chat(List<ChatMessage> messages, List<LlmFunctionTool> tools) {
        return chat(messages, tools, null, null, null);
    }

    public Flux<LlmChunk> chat(
            List<ChatMessage> messages,
            List<LlmFunctionTool> tools,
            Double temperature,
            Integer maxTokens,
            String purpose
    ) {
        return Flux.defer(() -> {
            ChatRequest request = new ChatRequest(
                    messages,
                    tools,
                    temperature == null ? defaultTemperature : temperature,
                    maxTokens == null ? defaultMaxTokens : maxTokens
            );
            Candidates candidates = buildCandidates(purpose);
            Flux<LlmChunk> stream = attempt(candidates.clients(), 0, request, null);
            ProviderClient oneShot = candidates.oneShot();
            if (oneShot == null) {
                return stream;
            }
            return stream.doFinally(signal -> closeQuietly(oneShot));
        });
    }

    public Mono<LlmResponse> chatComplete(
            List<ChatMessage> messages,
            List<LlmFunctionTool> tools,
            Double temperature,
            Integer maxTokens,
            String purpose
    ) {
        return chat(messages, tools, temperature, maxTokens, purpose)
                .collectList()
                .map(LlmResponse::fold);
    }

    // rebuilds the whole chain; replaced clients are closed after the swap
    public void reload(
            Map<String, AgentProviderProperties.ProviderConfig> providerConfigs,
            Map<String, PurposeOverride> purposeOverrides
    ) {
        if (clientFactory == null) {
            throw new IllegalStateException("ModelResolver was created without a ProviderClientFactory");
        }
        List<ProviderClient> previous;
        synchronized (reloadLock) {
            Map<String, AgentProviderProperties.ProviderConfig> configs = new LinkedHashMap<>();
            List<ProviderClient> clients = new ArrayList<>();
            if (providerConfigs != null) {
                for (Map.Entry<String, AgentProviderProperties.ProviderConfig> entry : providerConfigs.entrySet()) {
                    String providerId = entry.getKey();
                    AgentProviderProperties.ProviderConfig config = entry.getValue();
                    if (!StringUtils.hasText(providerId) || config == null) {
                        log.warn("Skip invalid provider config entry: key='{}'", providerId);
                        continue;
                    }
                    if (!config.isEnabled()) {
                        log.info("Skip disabled provider '{}'", providerId);
                        continue;
                    }
                    try {
                        ProviderClient client = clientFactory.create(providerId, config);
                        clients.add(client);
                        configs.put(client.providerId(), config.copy());
                    } catch (RuntimeException ex) {
                        log.warn("Failed to create client for provider '{}': {}", providerId, ex.getMessage());
                    }
                }
            }
            Snapshot current = snapshot;
            previous = current.clients();
            snapshot = new Snapshot(
                    List.copyOf(clients),
                    Map.copyOf(configs),
                    current.preferredProvider(),
                    purposeOverrides == null ? Map.of() : Map.copyOf(purposeOverrides)
            );
            log.info("Model clients reloaded, available providers: {}", clients.stream()
                    .filter(ProviderClient::isAvailable)
                    .map(ProviderClient::providerId)
                    .toList());
        }
        previous.forEach(this::closeQuietly);
    }

    // a null purpose sets the global preference, a null provider restores configuration order
    public void setPreferredProvider(String providerId, String purpose) {
        String normalized = StringUtils.hasText(providerId) ? providerId.trim() : null;
        synchronized (reloadLock) {
            Snapshot current = snapshot;
            if (!StringUtils.hasText(purpose)) {
                snapshot = new Snapshot(current.clients(), current.configs(), normalized, current.purposeOverrides());
                log.info("Preferred model provider set to: {}", normalized == null ? "(default order)" : normalized);
                return;
            }
            Map<String, PurposeOverride> overrides = new LinkedHashMap<>(current.purposeOverrides());
            if (normalized == null) {
                overrides.remove(purpose);
            } else {
                overrides.put(purpose, PurposeOverride.provider(normalized));
            }
            snapshot = new Snapshot(current.clients(), current.configs(), current.preferredProvider(), Map.copyOf(overrides));
            log.info("Provider for purpose '{}' set to: {}", purpose, normalized == null ? "(none)" : normalized);
        }
    }

    public String preferredProvider() {
        return snapshot.preferredProvider();
    }

    public Map<String, PurposeOverride> purposeOverrides() {
        return snapshot.purposeOverrides();
    }

    public List<ProviderClient> clients() {
        return snapshot.clients();
    }

    public Map<String, String> activeModelInfo() {
        for (ProviderClient client : orderedClients(snapshot)) {
            if (client.isAvailable()) {
                return Map.of(
                        "provider_id", client.providerId(),
                        "provider_name", client.displayName(),
                        "model", client.model()
                );
            }
        }
        return Map.of("provider_id", "", "provider_name", "no available model", "model", "");
    }

    private Flux<LlmChunk> attempt(List<ProviderClient> candidates, int position, ChatRequest request, Throwable lastError) {
        if (position >= candidates.size()) {
            if (lastError == null) {
                return Flux.error(new NoAvailableProviderException(
                        "No available LLM provider, configure api-key and model for at least one provider"));
            }
            return Flux.error(new NoAvailableProviderException(
                    "All LLM providers failed: " + describe(lastError), lastError));
        }
        ProviderClient client = candidates.get(position);
        if (!client.isAvailable()) {
            return attempt(candidates, position + 1, request, lastError);
        }
        AtomicBoolean emitted = new AtomicBoolean(false);
        return Flux.defer(() -> client.streamChat(request))
                .doOnNext(chunk -> emitted.set(true))
                .onErrorResume(ex -> !emitted.get(), ex -> {
                    if (ex instanceof UnsupportedOperationException) {
                        log.debug("LLM provider '{}' does not support streaming chat", client.providerId());
                    } else {
                        log.warn("LLM provider '{}' failed, trying next: {}", client.providerId(), describe(ex));
                    }
                    return attempt(candidates, position + 1, request, ex);
                });
    }

    private Candidates buildCandidates(String purpose) {
        Snapshot current = snapshot;
        PurposeOverride override = StringUtils.hasText(purpose) ? current.purposeOverrides().get(purpose) : null;
        if (override != null && override.namesProvider() && clientFactory != null) {
            ProviderClient oneShot = clientFactory.createOneShot(
                    override.providerId(),
                    current.configs().get(override.providerId().toLowerCase(Locale.ROOT)),
                    override.model(),
                    override.baseUrl()
            );
            List<ProviderClient> clients = new ArrayList<>(current.clients().size() + 1);
            clients.add(oneShot);
            clients.addAll(current.clients());
            return new Candidates(clients, oneShot);
        }
        return new Candidates(orderedClients(current), null);
    }

    private List<ProviderClient> orderedClients(Snapshot current) {
        String preferred = current.preferredProvider();
        if (preferred == null) {
            return current.clients();
        }
        List<ProviderClient> ordered = new ArrayList<>(current.clients().size());
        List<ProviderClient> others = new ArrayList<>();
        for (ProviderClient client : current.clients()) {
            if (preferred.equalsIgnoreCase(client.providerId())) {
                ordered.add(client);
            } else {
                others.add(client);
            }
        }
        ordered.addAll(others);
        return ordered;
    }

    private void closeQuietly(ProviderClient client) {
        try {
            client.close();
        } catch (Exception ex) {
            log.warn("Failed to close LLM client '{}': {}", client.providerId(), ex.getMessage());
        }
    }

    private static String describe(Throwable ex) {
        if (ex.getMessage() == null || ex.getMessage().isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return ex.getMessage();
    }

    private static Map<String, PurposeOverride> toPurposeOverrides(Map<String, LlmProperties.Purpose> purposes) {
        Map<String, PurposeOverride> overrides = new LinkedHashMap<>();
        if (purposes == null) {
            return overrides;
        }
        purposes.forEach((purpose, config) -> {
            if (StringUtils.hasText(purpose) && config != null) {
                overrides.put(purpose, new PurposeOverride(config.getProviderId(), config.getModel(), config.getBaseUrl()));
            }
        });
        return overrides;
    }

    private record Snapshot(
            List<ProviderClient> clients,
            Map<String, AgentProviderProperties.ProviderConfig> configs,
            String preferredProvider,
            Map<String, PurposeOverride> purposeOverrides
    ) {
    }

    private record Candidates(List<ProviderClient> clients, ProviderClient oneShot) {
    }
}
