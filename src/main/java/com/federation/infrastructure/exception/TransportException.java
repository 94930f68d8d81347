package com.federation.infrastructure.exception;

/**
 * A transport could not establish or maintain delivery for an edge. Always retriable.
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
