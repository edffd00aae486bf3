package com.deepansh.router.llm;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Boundary to a hosted language model. Classifiers and model-backed responders
 * reach providers only through this interface.
 */
public interface LlmClient {

    /**
     * Sends the conversation and available tools, returns the assistant's turn.
     */
    LlmResponse chat(LlmRequest request);

    /**
     * Streams the assistant's turn: text fragments as they arrive, then exactly one
     * {@link LlmStreamEvent#completed completed} event carrying the assembled turn.
     * Cold; cancelling the subscription stops the provider call.
     */
    default Flux<LlmStreamEvent> stream(LlmRequest request) {
        return Mono.fromCallable(() -> chat(request))
                .flatMapMany(response -> {
                    String text = response.getMessage().getText();
                    LlmStreamEvent done = LlmStreamEvent.completed(response);
                    return text.isEmpty()
                            ? Flux.just(done)
                            : Flux.just(LlmStreamEvent.fragment(text), done);
                });
    }
}
