package com.federation.application.federation.transport;

import com.federation.application.port.out.ContentStore;
import com.federation.application.port.out.ContentStore.ChangeSubscription;
import com.federation.application.port.out.ContentStore.ContentCursor;
import com.federation.application.port.out.ContentStore.ContentQuery;
import com.federation.application.port.out.SiteConnector;
import com.federation.application.port.out.SiteConnector.OpenMode;
import com.federation.application.port.out.SiteConnector.RemoteSite;
import com.federation.domain.model.ContentBatch;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.TransportKind;
import com.federation.infrastructure.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Keeps a complete local replica of the followed site's collection and reconciles from the replica's
 * change stream. The replica is filled by a full scan, with remote changes forwarded into it from the
 * moment the scan starts so nothing falls between scan and listener.
 */
public class FullMirrorTransport extends AbstractContentTransport<FullMirrorTransport.Mirror> {

    private static final Logger log = LoggerFactory.getLogger(FullMirrorTransport.class);

    private final SiteConnector connector;
    private final Supplier<ContentStore> replicaFactory;
    private final int scanBatchSize;

    public FullMirrorTransport(SiteConnector connector, Supplier<ContentStore> replicaFactory, int scanBatchSize) {
        this.connector = connector;
        this.replicaFactory = replicaFactory;
        this.scanBatchSize = scanBatchSize;
    }

    record Mirror(RemoteSite remote, ContentStore replica, ChangeSubscription forwarder,
                  ChangeSubscription delivery) implements Link {
        @Override
        public void close() {
            try {
                delivery.close();
                forwarder.close();
            } finally {
                remote.close();
            }
        }
    }

    @Override
    public TransportKind kind() {
        return TransportKind.FULL_MIRROR;
    }

    @Override
    public void start(FollowEdge edge, DeliverySink sink, Duration timeout) throws TransportException {
        RemoteSite remote = connector.open(edge.targetAddress(), OpenMode.REPLICATE, timeout);
        ContentStore replica = replicaFactory.get();
        ChangeSubscription forwarder = null;
        try {
            forwarder = remote.content().onChange((added, removed) -> {
                added.forEach(replica::put);
                removed.forEach(item -> replica.del(item.id()));
            });
            int copied = scan(remote.content(), replica);
            ChangeSubscription delivery = replica.onChange((added, removed) ->
                sink.delivered(ContentBatch.live(added, removed)));
            register(edge, new Mirror(remote, replica, forwarder, delivery));
            log.info("Mirroring {}: replica holds {} items after scan", edge.targetAddress(), copied);
        } catch (RuntimeException e) {
            if (forwarder != null) {
                forwarder.close();
            }
            remote.close();
            throw new TransportException("Could not mirror " + edge.targetAddress(), e);
        }
    }

    @Override
    public List<ContentItem> initialSnapshot(FollowEdge edge) {
        return linkFor(edge)
            .map(mirror -> mirror.replica().search(queryFor(edge)))
            .orElse(List.of());
    }

    private int scan(ContentStore source, ContentStore replica) {
        int copied = 0;
        try (ContentCursor cursor = source.iterate(ContentQuery.all())) {
            while (!cursor.done()) {
                List<ContentItem> batch = cursor.next(scanBatchSize);
                batch.forEach(replica::put);
                copied += batch.size();
            }
        }
        return copied;
    }
}
