package com.federation.infrastructure.exception;

/**
 * Sentinel raised when a store detects unreadable or inconsistent data on read.
 * Federation reads degrade to empty results when they see it.
 */
public class StoreCorruptedException extends StoreException {

    public StoreCorruptedException(String message) {
        super(message);
    }

    public StoreCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
