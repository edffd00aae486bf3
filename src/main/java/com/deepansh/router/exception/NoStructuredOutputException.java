package com.deepansh.router.exception;

/** The classifier's model response carried no structured-output block at all. */
public class NoStructuredOutputException extends ClassificationException {

    public NoStructuredOutputException(String message) {
        super(message);
    }
}
