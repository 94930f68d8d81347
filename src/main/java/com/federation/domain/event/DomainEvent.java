package com.federation.domain.event;

import java.time.Instant;
import java.util.UUID;

public sealed interface DomainEvent permits SiteContentChanged, FollowEdgeAdded, FollowEdgeRemoved {
    UUID eventId();
    String aggregateId();
    Instant occurredAt();
    String eventType();
}
