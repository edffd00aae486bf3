package com.deepansh.router.exception;

/**
 * Transient provider failure (5xx, rate limit, open circuit). Counts toward the circuit breaker.
 */
public class LlmUnavailableException extends AgentException {

    public LlmUnavailableException(String message) {
        super(message);
    }

    public LlmUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
