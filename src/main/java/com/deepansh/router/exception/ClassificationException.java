package com.deepansh.router.exception;

/** A single classification attempt failed; the orchestrator may retry it. */
public class ClassificationException extends AgentException {

    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
