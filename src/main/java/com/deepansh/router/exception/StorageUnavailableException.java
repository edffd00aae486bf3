package com.deepansh.router.exception;

/** The history backend could not be read or written. */
public class StorageUnavailableException extends AgentException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
