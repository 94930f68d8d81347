package com.federation.application.port.out;

import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.SiteAddress;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FollowEdgeRepository {
    void save(FollowEdge edge);
    boolean delete(UUID edgeId);
    Optional<FollowEdge> findById(UUID edgeId);
    boolean existsByTarget(SiteAddress targetAddress);

    /**
     * Edges ordered by creation time (newest first).
     * Cursor is ISO timestamp of the last edge's created_at.
     */
    List<FollowEdge> findPage(String cursor, int limit);

    /**
     * Every persisted edge, used to rebuild sessions on start.
     */
    List<FollowEdge> findAll();

    long count();
}
