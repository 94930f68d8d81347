package com.federation.application.federation;

import com.federation.application.port.out.ContentStore;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.FollowEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Full-copy import into the local content store.
 */
public class ContentStoreTarget implements ImportTarget {

    private static final Logger log = LoggerFactory.getLogger(ContentStoreTarget.class);

    private final ContentStore store;

    public ContentStoreTarget(ContentStore store) {
        this.store = store;
    }

    @Override
    public boolean contains(ContentItem incoming, FollowEdge edge) {
        return store.get(incoming.id()).isPresent();
    }

    @Override
    public boolean write(ContentItem federated, FollowEdge edge) {
        store.put(federated);
        return true;
    }

    @Override
    public boolean evict(ContentItem removed, FollowEdge edge) {
        Optional<ContentItem> local = store.get(removed.id());
        if (local.isEmpty()) {
            return false;
        }
        if (!edge.targetAddress().matches(local.get().federatedFrom())) {
            log.debug("Keeping {}: local provenance {} is not {}", removed.id(),
                local.get().federatedFrom(), edge.targetAddress());
            return false;
        }
        return store.del(removed.id()).isPresent();
    }
}
