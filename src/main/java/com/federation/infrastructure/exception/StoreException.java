package com.federation.infrastructure.exception;

/**
 * Failure reported by a content or index store collaborator.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
