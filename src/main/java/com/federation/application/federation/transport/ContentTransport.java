package com.federation.application.federation.transport;

import com.federation.domain.model.ContentItem;
import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.TransportKind;
import com.federation.infrastructure.exception.TransportException;

import java.time.Duration;
import java.util.List;

/**
 * A strategy for getting a followed site's content changes to this node.
 * All strategies feed the same reconciliation entry point and differ only in latency, bandwidth and durability.
 */
public interface ContentTransport {

    TransportKind kind();

    /**
     * Establishes delivery for the edge. Replaces any previous link for the same edge.
     *
     * @throws TransportException if the remote side cannot be reached within {@code timeout}
     */
    void start(FollowEdge edge, DeliverySink sink, Duration timeout) throws TransportException;

    /**
     * Tears down delivery for the edge. Safe to call repeatedly or for an edge that never started.
     */
    void stop(FollowEdge edge);

    /**
     * Content currently visible through the established link, filtered by the edge's recursion rule.
     * Empty when the transport catches up by other means.
     */
    List<ContentItem> initialSnapshot(FollowEdge edge);

    boolean isLinked(FollowEdge edge);
}
