package com.federation.application.port.out;

/**
 * External access-control collaborator.
 */
public interface AccessControl {

    /**
     * Public key of this node's own identity.
     */
    String publicKey();

    boolean canWrite(String actorKey);
}
