package com.federation.application.federation.transport;

import com.federation.application.port.out.ContentStore.ChangeSubscription;
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

/**
 * Listens directly on the followed site's content collection. Changes reach the sink as soon as the
 * remote store emits them, at the cost of keeping the remote collection open for the life of the edge.
 */
public class RealTimeEventTransport extends AbstractContentTransport<RealTimeEventTransport.ObservedSite> {

    private static final Logger log = LoggerFactory.getLogger(RealTimeEventTransport.class);

    private final SiteConnector connector;

    public RealTimeEventTransport(SiteConnector connector) {
        this.connector = connector;
    }

    record ObservedSite(RemoteSite remote, ChangeSubscription subscription) implements Link {
        @Override
        public void close() {
            try {
                subscription.close();
            } finally {
                remote.close();
            }
        }
    }

    @Override
    public TransportKind kind() {
        return TransportKind.REAL_TIME;
    }

    @Override
    public void start(FollowEdge edge, DeliverySink sink, Duration timeout) throws TransportException {
        RemoteSite remote = connector.open(edge.targetAddress(), OpenMode.OBSERVE, timeout);
        ChangeSubscription subscription;
        try {
            subscription = remote.content().onChange((added, removed) ->
                sink.delivered(ContentBatch.live(added, removed)));
        } catch (RuntimeException e) {
            remote.close();
            throw new TransportException("Could not listen on " + edge.targetAddress(), e);
        }
        register(edge, new ObservedSite(remote, subscription));
        log.info("Listening for changes on {}", edge.targetAddress());
    }

    @Override
    public List<ContentItem> initialSnapshot(FollowEdge edge) {
        return linkFor(edge)
            .map(site -> site.remote().content().search(queryFor(edge)))
            .orElse(List.of());
    }
}
