package com.federation.infrastructure.metrics;

import com.federation.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter followEdgesAdded;
    private final Counter followEdgesRemoved;
    private final Counter itemsImported;
    private final Counter itemsEvicted;
    private final Counter itemsSkipped;
    private final Counter itemsFailed;
    private final Counter busMessagesDropped;
    private final Counter sessionReconnects;
    private final Counter sessionFailures;
    private final Counter outboxEventsPublished;
    private final Timer reconcileDuration;

    public AppMetrics(MeterRegistry registry) {
        this.followEdgesAdded = Counter.builder("federation_follow_edges_added_total")
            .description("Total number of follow edges added")
            .register(registry);

        this.followEdgesRemoved = Counter.builder("federation_follow_edges_removed_total")
            .description("Total number of follow edges removed")
            .register(registry);

        this.itemsImported = reconcileCounter(registry, "imported");
        this.itemsEvicted = reconcileCounter(registry, "evicted");
        this.itemsSkipped = reconcileCounter(registry, "skipped");
        this.itemsFailed = reconcileCounter(registry, "failed");

        this.busMessagesDropped = Counter.builder("federation_bus_messages_dropped_total")
            .description("Inbound update messages dropped as malformed or misaddressed")
            .register(registry);

        this.sessionReconnects = Counter.builder("federation_session_reconnects_total")
            .description("Reconnects scheduled for degraded sessions")
            .register(registry);

        this.sessionFailures = Counter.builder("federation_session_failures_total")
            .description("Sessions that exhausted their connect attempts")
            .register(registry);

        this.outboxEventsPublished = Counter.builder("outbox_events_published_total")
            .description("Total number of outbox events published to Kafka")
            .register(registry);

        this.reconcileDuration = Timer.builder("federation_reconcile_duration_seconds")
            .description("Time taken to reconcile one delivery")
            .register(registry);
    }

    private static Counter reconcileCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("federation_reconciled_items_total")
            .description("Items processed by reconciliation, by outcome")
            .tag("outcome", outcome)
            .register(registry);
    }

    @Override
    public void incrementFollowEdgesAdded() {
        followEdgesAdded.increment();
    }

    @Override
    public void incrementFollowEdgesRemoved() {
        followEdgesRemoved.increment();
    }

    @Override
    public void recordReconcile(int imported, int evicted, int skipped, int failed) {
        itemsImported.increment(imported);
        itemsEvicted.increment(evicted);
        itemsSkipped.increment(skipped);
        itemsFailed.increment(failed);
    }

    @Override
    public void incrementBusMessagesDropped() {
        busMessagesDropped.increment();
    }

    @Override
    public void incrementSessionReconnects() {
        sessionReconnects.increment();
    }

    @Override
    public void incrementSessionFailures() {
        sessionFailures.increment();
    }

    @Override
    public void incrementOutboxEventsPublished(int count) {
        outboxEventsPublished.increment(count);
    }

    @Override
    public <T> T recordReconcileDuration(Supplier<T> operation) {
        return reconcileDuration.record(operation);
    }
}
