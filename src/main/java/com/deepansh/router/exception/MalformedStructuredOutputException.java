package com.deepansh.router.exception;

/** A structured-output block was found but does not match the decision schema. */
public class MalformedStructuredOutputException extends ClassificationException {

    public MalformedStructuredOutputException(String message) {
        super(message);
    }

    public MalformedStructuredOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
