package com.federation.domain.model;

/**
 * Lifecycle of a per-edge subscription session:
 * CONNECTING -> ACTIVE -> DEGRADED -> RECONNECTING -> (ACTIVE | FAILED).
 */
public enum SessionStatus {
    CONNECTING,
    ACTIVE,
    DEGRADED,
    RECONNECTING,
    FAILED,
    CLOSED
}
