package com.deepansh.router.exception;

/** Non-retryable error reported by a model provider (bad key, bad request, unparseable body). */
public class LlmException extends AgentException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
