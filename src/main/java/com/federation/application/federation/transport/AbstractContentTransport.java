package com.federation.application.federation.transport;

import com.federation.application.port.out.ContentStore.ContentQuery;
import com.federation.domain.model.FollowEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one link per edge and makes teardown idempotent.
 *
 * @param <L> the per-edge resources a concrete transport holds
 */
public abstract class AbstractContentTransport<L extends AbstractContentTransport.Link> implements ContentTransport {

    private static final Logger log = LoggerFactory.getLogger(AbstractContentTransport.class);

    private final Map<UUID, L> links = new ConcurrentHashMap<>();

    public interface Link {
        void close();
    }

    protected void register(FollowEdge edge, L link) {
        L previous = links.put(edge.id(), link);
        if (previous != null) {
            closeQuietly(edge, previous);
        }
    }

    protected Optional<L> linkFor(FollowEdge edge) {
        return Optional.ofNullable(links.get(edge.id()));
    }

    @Override
    public void stop(FollowEdge edge) {
        L link = links.remove(edge.id());
        if (link != null) {
            closeQuietly(edge, link);
            log.info("{} transport stopped for {}", kind(), edge.targetAddress());
        }
    }

    @Override
    public boolean isLinked(FollowEdge edge) {
        return links.containsKey(edge.id());
    }

    protected static ContentQuery queryFor(FollowEdge edge) {
        return edge.recursive() ? ContentQuery.all() : ContentQuery.originals();
    }

    private void closeQuietly(FollowEdge edge, L link) {
        try {
            link.close();
        } catch (RuntimeException e) {
            log.warn("Error closing {} link for {}: {}", kind(), edge.targetAddress(), e.getMessage());
        }
    }
}
