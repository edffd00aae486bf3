package com.deepansh.router.exception;

public class MalformedMessageException extends AgentException {

    public MalformedMessageException(String message) {
        super(message);
    }
}
