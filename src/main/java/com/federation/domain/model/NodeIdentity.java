package com.federation.domain.model;

/**
 * This node's own address, display name and acting key.
 */
public record NodeIdentity(SiteAddress address, String name, String publicKey) {
}
