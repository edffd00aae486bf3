package com.deepansh.router.llm;

import com.deepansh.router.exception.LlmUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Decorator around the active provider client that adds a circuit breaker.
 *
 * Calls are not retried here; the orchestrator owns the classifier retry budget.
 *
 * Circuit breaker config (application.yml):
 * - Opens after 50% failure rate in a sliding window of 10 calls
 * - Waits 30s before allowing trial calls (half-open state)
 * - Only {@link LlmUnavailableException} counts as a failure
 * - Streams are decorated by the Reactor operator: the outcome is recorded when the stream terminates
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @CircuitBreaker(name = "llmClient", fallbackMethod = "circuitOpen")
    public LlmResponse chat(LlmRequest request) {
        return delegate.chat(request);
    }

    @Override
    @CircuitBreaker(name = "llmClient", fallbackMethod = "circuitOpenWhileStreaming")
    public Flux<LlmStreamEvent> stream(LlmRequest request) {
        return delegate.stream(request);
    }

    /** Only invoked for short-circuited calls; real failures propagate unchanged. */
    public LlmResponse circuitOpen(LlmRequest request, CallNotPermittedException ex) {
        log.error("LLM circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        throw new LlmUnavailableException("LLM service is temporarily unavailable", ex);
    }

    public Flux<LlmStreamEvent> circuitOpenWhileStreaming(LlmRequest request, CallNotPermittedException ex) {
        log.error("LLM circuit breaker is OPEN, rejecting stream: {}", ex.getMessage());
        return Flux.error(new LlmUnavailableException("LLM service is temporarily unavailable", ex));
    }
}
