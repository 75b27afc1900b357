package com.braid.core.state;

/**
 * Raised when the orchestration state document cannot be read or written.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
