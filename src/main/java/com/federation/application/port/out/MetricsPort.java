package com.federation.application.port.out;

import java.util.function.Supplier;

/**
 * Port for recording federation metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementFollowEdgesAdded();

    void incrementFollowEdgesRemoved();

    void recordReconcile(int imported, int evicted, int skipped, int failed);

    void incrementBusMessagesDropped();

    void incrementSessionReconnects();

    void incrementSessionFailures();

    void incrementOutboxEventsPublished(int count);

    <T> T recordReconcileDuration(Supplier<T> operation);
}
