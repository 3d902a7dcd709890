package com.linlay.analysisagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.analysisagent.llm.model.ChatRequest;
import com.linlay.analysisagent.llm.model.LlmChunk;
import com.linlay.analysisagent.llm.model.LlmDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

abstract class AbstractSseProviderClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(AbstractSseProviderClient.class);

    protected final ProviderSettings settings;
    protected final ObjectMapper objectMapper;
    protected final LlmCallLogger callLogger;
    private final Duration streamTimeout;
    private final ConnectionProvider connectionProvider;

    protected AbstractSseProviderClient(
            ProviderSettings settings,
            ObjectMapper objectMapper,
            LlmCallLogger callLogger,
            Duration streamTimeout
    ) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.callLogger = callLogger == null ? new LlmCallLogger() : callLogger;
        this.streamTimeout = streamTimeout == null ? Duration.ofMillis(60_000) : streamTimeout;
        this.connectionProvider = ConnectionProvider.builder("llm-" + settings.providerId())
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    protected abstract String completionsUri(String baseUrl);

    protected abstract void applyHeaders(HttpHeaders headers);

    protected abstract Map<String, Object> buildRequestBody(ChatRequest request);

    protected abstract LlmDelta parseDelta(String rawChunk);

    @Override
    public String providerId() {
        return settings.providerId();
    }

    @Override
    public String displayName() {
        return settings.displayName();
    }

    @Override
    public String model() {
        return settings.model() == null ? "" : settings.model();
    }

    @Override
    public boolean isAvailable() {
        return settings.isAvailable();
    }

    public ProviderSettings settings() {
        return settings;
    }

    @Override
    public Flux<LlmChunk> streamChat(ChatRequest request) {
        return Flux.defer(() -> {
            validateSettings();
            String traceId = callLogger.generateTraceId();
            long startNanos = System.nanoTime();
            Map<String, Object> body = buildRequestBody(request);
            DeltaNormalizer normalizer = new DeltaNormalizer(settings.cumulativeText());
            StringBuilder responseBuffer = new StringBuilder();
            AtomicBoolean firstChunkReceived = new AtomicBoolean(false);

            callLogger.info(log, "[{}][{}] LLM stream request start model={}, key={}, messages={}, tools={}",
                    traceId, providerId(), model(), LlmLogSanitizer.maskApiKey(settings.apiKey()), request.messages().size(), request.tools().size());
            callLogger.logMessages(log, traceId, providerId(), request.messages());

            return buildWebClient().post()
                    .uri(completionsUri(settings.baseUrl()))
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToFlux(String.class)
                    .doOnNext(rawChunk -> firstChunkReceived.set(true))
                    .retryWhen(Retry.max(1)
                            .filter(ex -> !firstChunkReceived.get() && isConnectionError(ex)))
                    .doOnNext(rawChunk -> callLogger.debug(log, "[{}][{}][raw-delta] {}",
                            traceId, providerId(), callLogger.sanitizeText(rawChunk)))
                    .<LlmChunk>handle((rawChunk, sink) -> {
                        LlmChunk chunk = normalizer.apply(parseDelta(rawChunk));
                        if (chunk != null) {
                            sink.next(chunk);
                        }
                    })
                    .concatWith(Flux.defer(() -> Flux.fromIterable(normalizer.complete())))
                    .doOnNext(chunk -> callLogger.appendChunkLog(responseBuffer, chunk))
                    .doOnComplete(() -> callLogger.info(log, "[{}][{}] LLM stream finished in {} ms:\n{}",
                            traceId, providerId(), callLogger.elapsedMs(startNanos), responseBuffer))
                    .doOnError(ex -> log.warn("[{}][{}] LLM stream failed in {} ms: {}",
                            traceId, providerId(), callLogger.elapsedMs(startNanos), describe(ex)))
                    .timeout(streamTimeout)
                    .onErrorMap(ex -> !(ex instanceof ProviderException),
                            ex -> new ProviderException(providerId(), describe(ex), ex));
        });
    }

    @Override
    public void close() {
        if (!connectionProvider.isDisposed()) {
            connectionProvider.dispose();
            log.debug("Released connection pool for provider '{}'", providerId());
        }
    }

    protected String describe(Throwable ex) {
        if (ex instanceof WebClientResponseException responseException) {
            String responseBody = responseException.getResponseBodyAsString();
            return "HTTP " + responseException.getStatusCode().value()
                    + (StringUtils.hasText(responseBody) ? ": " + callLogger.sanitizeText(responseBody) : "");
        }
        if (ex.getMessage() == null || ex.getMessage().isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return ex.getMessage();
    }

    private void validateSettings() {
        if (!StringUtils.hasText(settings.baseUrl())) {
            throw new ProviderException(providerId(), "Missing base-url for provider: " + providerId());
        }
        if (settings.requiresApiKey() && !StringUtils.hasText(settings.apiKey())) {
            throw new ProviderException(providerId(), "Missing api-key for provider: " + providerId());
        }
        if (!StringUtils.hasText(settings.model())) {
            throw new ProviderException(providerId(), "Missing model for provider: " + providerId());
        }
    }

    private WebClient buildWebClient() {
        HttpClient httpClient = HttpClient.create(connectionProvider);
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .baseUrl(settings.baseUrl())
                .defaultHeaders(headers -> {
                    headers.set(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
                    applyHeaders(headers);
                    settings.headers().forEach(headers::set);
                })
                .filter((clientRequest, next) -> {
                    callLogger.debug(log, "[llm-webclient][request] {} {} headers={}",
                            clientRequest.method(), clientRequest.url(), callLogger.sanitizeHeaders(clientRequest.headers()));
                    return next.exchange(clientRequest);
                })
                .build();
    }

    private boolean isConnectionError(Throwable ex) {
        if (ex instanceof IOException) {
            return true;
        }
        Throwable cause = ex.getCause();
        return cause instanceof IOException;
    }
}
