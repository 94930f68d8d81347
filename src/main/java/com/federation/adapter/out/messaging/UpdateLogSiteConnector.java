package com.federation.adapter.out.messaging;

import com.federation.adapter.out.store.InMemoryContentStore;
import com.federation.application.federation.transport.SyncUpdateCodec;
import com.federation.application.federation.transport.SyncUpdateMessage;
import com.federation.application.federation.transport.UpdateTopics;
import com.federation.application.port.out.ContentStore;
import com.federation.application.port.out.IdGenerator;
import com.federation.application.port.out.MessageBus;
import com.federation.application.port.out.MessageBus.BusSubscription;
import com.federation.application.port.out.MetricsPort;
import com.federation.application.port.out.SiteConnector;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.NodeIdentity;
import com.federation.domain.model.SiteAddress;
import com.federation.infrastructure.exception.SiteUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Opens a peer by reading its update topic. Every open subscribes under a fresh consumer group, so the
 * broker replays the peer's log from the earliest retained offset, and folds each update into an
 * in-memory replica. The handle's collection is that replica: it fills as the replay proceeds and keeps
 * following live updates until the handle is closed.
 */
public class UpdateLogSiteConnector implements SiteConnector {

    private static final Logger log = LoggerFactory.getLogger(UpdateLogSiteConnector.class);

    private final MessageBus bus;
    private final UpdateTopics topics;
    private final SyncUpdateCodec codec;
    private final NodeIdentity localNode;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;

    public UpdateLogSiteConnector(
            MessageBus bus,
            UpdateTopics topics,
            SyncUpdateCodec codec,
            NodeIdentity localNode,
            IdGenerator idGenerator,
            MetricsPort metrics) {
        this.bus = bus;
        this.topics = topics;
        this.codec = codec;
        this.localNode = localNode;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
    }

    @Override
    public RemoteSite open(SiteAddress address, OpenMode mode, Duration timeout) throws SiteUnavailableException {
        String topic = topics.updatesTopic(address);
        String group = topics.replayGroup(localNode.address(), address, idGenerator.generate());
        InMemoryContentStore replica = new InMemoryContentStore();
        AtomicReference<String> name = new AtomicReference<>(address.value());
        BusSubscription subscription;
        try {
            subscription = bus.subscribe(topic, group, payload -> apply(address, replica, name, payload));
        } catch (RuntimeException e) {
            throw new SiteUnavailableException(address, "could not read " + topic + ": " + e.getMessage());
        }
        log.debug("Reading update log {} as {} in {} mode", topic, group, mode);
        return new UpdateLogSite(address, name, replica, subscription);
    }

    private void apply(SiteAddress address, ContentStore replica, AtomicReference<String> name, String payload) {
        Optional<SyncUpdateMessage> decoded = codec.decode(payload);
        if (decoded.isEmpty()) {
            metrics.incrementBusMessagesDropped();
            return;
        }
        SyncUpdateMessage message = decoded.get();
        if (!address.matches(message.siteId())) {
            log.warn("Ignoring update from {} in the log of {}", message.siteId(), address);
            metrics.incrementBusMessagesDropped();
            return;
        }
        if (message.siteName() != null && !message.siteName().isBlank()) {
            name.set(message.siteName());
        }
        for (ContentItem item : message.added()) {
            replica.put(item);
        }
        for (ContentItem item : message.removed()) {
            replica.del(item.id());
        }
    }

    private static final class UpdateLogSite implements RemoteSite {
        private final SiteAddress address;
        private final AtomicReference<String> name;
        private final ContentStore replica;
        private final BusSubscription subscription;

        private UpdateLogSite(
                SiteAddress address,
                AtomicReference<String> name,
                ContentStore replica,
                BusSubscription subscription) {
            this.address = address;
            this.name = name;
            this.replica = replica;
            this.subscription = subscription;
        }

        @Override
        public SiteAddress address() {
            return address;
        }

        @Override
        public String name() {
            return name.get();
        }

        @Override
        public ContentStore content() {
            return replica;
        }

        @Override
        public void close() {
            subscription.close();
            log.debug("Stopped reading the update log of {}", address);
        }
    }
}
