package com.deepansh.router.exception;

import lombok.Getter;

/** Every classification attempt failed. */
@Getter
public class ClassificationFailedException extends AgentException {

    private final int attempts;

    public ClassificationFailedException(int attempts, Throwable lastCause) {
        super("Classification failed after " + attempts + " attempt(s)", lastCause);
        this.attempts = attempts;
    }
}
