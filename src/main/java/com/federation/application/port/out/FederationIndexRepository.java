package com.federation.application.port.out;

import com.federation.domain.model.FederationIndexEntry;

import java.util.List;
import java.util.Optional;

/**
 * Backing collection of the federation index.
 * Reads may throw {@link com.federation.infrastructure.exception.StoreCorruptedException}.
 */
public interface FederationIndexRepository {
    /**
     * Stores the entry under its id. Returns false if an entry with that id already existed.
     */
    boolean put(FederationIndexEntry entry);
    boolean delete(String id);
    boolean exists(String id);
    Optional<FederationIndexEntry> findById(String id);

    /**
     * All entries, newest first.
     */
    List<FederationIndexEntry> findAll();

    /**
     * Removes every entry whose source site is {@code sourceSiteId}. Returns the count removed.
     */
    int deleteBySourceSite(String sourceSiteId);
}
