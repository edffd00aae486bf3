package com.deepansh.router.exception;

/**
 * Base of every failure raised by the router. Unchecked: callers decide where to recover.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
