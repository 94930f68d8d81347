package com.federation.domain.event;

import com.federation.domain.model.SiteAddress;

import java.time.Instant;
import java.util.UUID;

public record FollowEdgeAdded(
    UUID eventId,
    UUID edgeId,
    SiteAddress targetAddress,
    boolean recursive,
    Instant occurredAt
) implements DomainEvent {

    public static FollowEdgeAdded from(UUID eventId, UUID edgeId, SiteAddress targetAddress, boolean recursive) {
        return new FollowEdgeAdded(eventId, edgeId, targetAddress, recursive, Instant.now());
    }

    @Override
    public String aggregateId() {
        return edgeId.toString();
    }

    @Override
    public String eventType() {
        return "FOLLOW_EDGE_ADDED";
    }
}
