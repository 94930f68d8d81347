package com.federation.infrastructure.exception;

/**
 * The store's access control refused a write for the acting identity.
 */
public class WriteDeniedException extends StoreException {

    private final String actorKey;

    public WriteDeniedException(String actorKey, String message) {
        super(message);
        this.actorKey = actorKey;
    }

    public String getActorKey() {
        return actorKey;
    }
}
