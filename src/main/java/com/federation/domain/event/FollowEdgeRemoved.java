package com.federation.domain.event;

import com.federation.domain.model.SiteAddress;

import java.time.Instant;
import java.util.UUID;

public record FollowEdgeRemoved(
    UUID eventId,
    UUID edgeId,
    SiteAddress targetAddress,
    Instant occurredAt
) implements DomainEvent {

    public static FollowEdgeRemoved from(UUID eventId, UUID edgeId, SiteAddress targetAddress) {
        return new FollowEdgeRemoved(eventId, edgeId, targetAddress, Instant.now());
    }

    @Override
    public String aggregateId() {
        return edgeId.toString();
    }

    @Override
    public String eventType() {
        return "FOLLOW_EDGE_REMOVED";
    }
}
