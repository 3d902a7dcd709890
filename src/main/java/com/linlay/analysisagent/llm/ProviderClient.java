package com.linlay.analysisagent.llm;

import com.linlay.analysisagent.llm.model.ChatRequest;
import com.linlay.analysisagent.llm.model.LlmChunk;
import reactor.core.publisher.Flux;

/**
 * Streaming chat against one provider. Call {@link #close()} once the client is replaced or its one-shot use ends.
 */
public interface ProviderClient extends AutoCloseable {

    String providerId();

    String displayName();

    String model();

    boolean isAvailable();

    /**
     * Cold: every subscription sends a new request.
     */
    Flux<LlmChunk> streamChat(ChatRequest request);

    @Override
    default void close() {
    }
}
