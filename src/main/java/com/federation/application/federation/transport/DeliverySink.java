package com.federation.application.federation.transport;

import com.federation.domain.model.ContentBatch;

/**
 * Receives deliveries from a transport. Implementations must not block the calling thread for long;
 * the session manager queues each delivery for ordered reconciliation.
 */
@FunctionalInterface
public interface DeliverySink {
    void delivered(ContentBatch batch);
}
