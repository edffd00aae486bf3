package com.deepansh.router.exception;

/**
 * A responder could not produce a reply (transport failure, timeout, empty output).
 * Never retried by the orchestrator.
 */
public class ResponderException extends AgentException {

    public ResponderException(String message) {
        super(message);
    }

    public ResponderException(String message, Throwable cause) {
        super(message, cause);
    }
}
