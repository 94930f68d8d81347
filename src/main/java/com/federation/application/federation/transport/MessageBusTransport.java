package com.federation.application.federation.transport;

import com.federation.application.federation.retry.CancellationToken;
import com.federation.application.port.out.MessageBus;
import com.federation.application.port.out.MessageBus.BusSubscription;
import com.federation.application.port.out.MetricsPort;
import com.federation.domain.model.ContentBatch;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.NodeIdentity;
import com.federation.domain.model.TransportKind;
import com.federation.infrastructure.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Follows a site through its update topic. Starting an edge subscribes to the topic for live updates
 * and launches a bounded historical sync to catch up on what was published before.
 */
public class MessageBusTransport extends AbstractContentTransport<MessageBusTransport.TopicLink> {

    private static final Logger log = LoggerFactory.getLogger(MessageBusTransport.class);

    private final MessageBus bus;
    private final UpdateTopics topics;
    private final SyncUpdateCodec codec;
    private final HistoricalSync historicalSync;
    private final NodeIdentity localNode;
    private final MetricsPort metrics;

    public MessageBusTransport(
            MessageBus bus,
            UpdateTopics topics,
            SyncUpdateCodec codec,
            HistoricalSync historicalSync,
            NodeIdentity localNode,
            MetricsPort metrics) {
        this.bus = bus;
        this.topics = topics;
        this.codec = codec;
        this.historicalSync = historicalSync;
        this.localNode = localNode;
        this.metrics = metrics;
    }

    record TopicLink(BusSubscription subscription, CancellationToken historical) implements Link {
        @Override
        public void close() {
            historical.cancel();
            subscription.close();
        }
    }

    @Override
    public TransportKind kind() {
        return TransportKind.MESSAGE_BUS;
    }

    @Override
    public void start(FollowEdge edge, DeliverySink sink, Duration timeout) throws TransportException {
        String topic = topics.updatesTopic(edge.targetAddress());
        String group = topics.consumerGroup(localNode.address(), edge.targetAddress());
        BusSubscription subscription;
        try {
            subscription = bus.subscribe(topic, group, payload -> onMessage(edge, sink, payload));
        } catch (RuntimeException e) {
            throw new TransportException("Could not subscribe to " + topic, e);
        }
        CancellationToken historical = new CancellationToken();
        register(edge, new TopicLink(subscription, historical));
        log.info("Subscribed to {} as {}", topic, group);
        historicalSync.run(edge, sink, historical);
    }

    /**
     * Historical sync delivers the catch-up state, so there is nothing to reconcile up front.
     */
    @Override
    public List<ContentItem> initialSnapshot(FollowEdge edge) {
        return List.of();
    }

    void onMessage(FollowEdge edge, DeliverySink sink, String payload) {
        MDC.put("edgeId", edge.id().toString());
        MDC.put("siteId", edge.targetAddress().value());
        try {
            Optional<SyncUpdateMessage> decoded = codec.decode(payload);
            if (decoded.isEmpty()) {
                metrics.incrementBusMessagesDropped();
                return;
            }
            SyncUpdateMessage message = decoded.get();
            if (!edge.targetAddress().matches(message.siteId())) {
                log.warn("Dropping update from {} on the topic of {}", message.siteId(), edge.targetAddress());
                metrics.incrementBusMessagesDropped();
                return;
            }
            log.debug("Update from {}: {} added, {} removed", message.siteId(),
                message.added().size(), message.removed().size());
            sink.delivered(ContentBatch.live(message.added(), message.removed()));
        } catch (RuntimeException e) {
            log.error("Failed to handle update for {}: {}", edge.targetAddress(), e.getMessage(), e);
        } finally {
            MDC.remove("edgeId");
            MDC.remove("siteId");
        }
    }
}
