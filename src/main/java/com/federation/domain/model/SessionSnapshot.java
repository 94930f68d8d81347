package com.federation.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a session for operators.
 */
public record SessionSnapshot(
    UUID edgeId,
    SiteAddress targetAddress,
    SessionStatus status,
    Instant lastActivity,
    int reconnectAttempts,
    TransportKind transport
) {
}
