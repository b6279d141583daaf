package io.github.drompincen.tablecopilot.runtime.agent.llm;

import reactor.core.publisher.Flux;

public interface LlmService {

    Flux<String> streamResponse(CompletionRequest request);

    String blockingResponse(CompletionRequest request);

    /**
     * Returns true if this LLM service has a working provider configured.
     */
    default boolean isAvailable() { return true; }

    default String getProviderInfo() { return getClass().getSimpleName(); }
}
