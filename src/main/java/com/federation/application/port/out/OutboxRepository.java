package com.federation.application.port.out;

import com.federation.domain.event.DomainEvent;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface OutboxRepository {
    void save(DomainEvent event, String requestId);
    List<OutboxEntry> findUnprocessedWithLock(int limit);
    void markAsProcessed(List<UUID> ids);
    void deleteProcessedOlderThan(Instant threshold);
    long countUnprocessed();

    record OutboxEntry(
        UUID id,
        String eventType,
        String aggregateId,
        String payload,
        String requestId
    ) {}
}
