package com.federation.application.federation;

import com.federation.domain.model.ContentItem;
import com.federation.domain.model.FollowEdge;

/**
 * Where accepted items land: the local content store or the federation index.
 */
public interface ImportTarget {

    /**
     * Whether the item is already present locally under its deterministic id.
     */
    boolean contains(ContentItem incoming, FollowEdge edge);

    /**
     * Writes the provenance-stamped copy. Returns false if the write was refused by policy.
     *
     * @throws com.federation.infrastructure.exception.WriteDeniedException if the store refuses the write
     */
    boolean write(ContentItem federated, FollowEdge edge);

    /**
     * Removes the local copy of a remotely removed item, but only when that copy came from the edge's target.
     * Returns true if something was removed.
     */
    boolean evict(ContentItem removed, FollowEdge edge);
}
