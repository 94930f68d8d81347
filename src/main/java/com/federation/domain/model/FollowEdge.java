package com.federation.domain.model;

import com.federation.domain.error.ValidationError.FollowValidationError;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A directed subscription from this node to a target site.
 * {@code recursive=false} imports only content originated at the target; {@code true} imports
 * everything the target holds, including what it federated from elsewhere.
 * {@code followChain} records the intermediaries for diagnosing multi-hop propagation.
 */
public record FollowEdge(
    UUID id,
    SiteAddress targetAddress,
    String displayName,
    boolean recursive,
    List<SiteAddress> followChain,
    Instant createdAt
) {

    public FollowEdge {
        followChain = followChain == null ? List.of() : List.copyOf(followChain);
    }

    /**
     * Creates a follow edge, returning a Result for expected validation failures.
     * The display name defaults to the target address and the chain to the target alone.
     */
    public static Result<FollowEdge, FollowValidationError> create(
            UUID id,
            SiteAddress localAddress,
            SiteAddress targetAddress,
            String displayName,
            boolean recursive,
            List<SiteAddress> followChain,
            Instant now) {
        if (localAddress.equals(targetAddress)) {
            return Result.failure(FollowValidationError.SelfFollow.INSTANCE);
        }
        String name = displayName == null || displayName.isBlank() ? targetAddress.value() : displayName.trim();
        List<SiteAddress> chain = followChain == null || followChain.isEmpty() ? List.of(targetAddress) : followChain;
        return Result.success(new FollowEdge(id, targetAddress, name, recursive, chain, now));
    }

    /**
     * Whether an item with the given provenance passes this edge's recursion rule.
     */
    public boolean accepts(ContentItem item) {
        return recursive || !item.federated();
    }
}
