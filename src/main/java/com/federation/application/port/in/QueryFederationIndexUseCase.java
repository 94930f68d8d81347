package com.federation.application.port.in;

import com.federation.domain.model.FederationIndexEntry;
import com.federation.domain.model.IndexQuery;
import com.federation.domain.model.IndexStats;

import java.time.Instant;
import java.util.List;

/**
 * Discovery reads over the federation index. None of these raise on an empty or corrupted store.
 */
public interface QueryFederationIndexUseCase {
    List<FederationIndexEntry> getRecent(int limit, int offset);
    List<FederationIndexEntry> getByCategory(String categoryId);
    List<FederationIndexEntry> getByTags(List<String> tags);
    List<FederationIndexEntry> getBySourceSite(String sourceSiteId);
    List<FederationIndexEntry> search(String text);
    List<FederationIndexEntry> getByTimeRange(Instant after, Instant before);
    List<FederationIndexEntry> getFeatured();
    List<FederationIndexEntry> getPromoted();
    List<FederationIndexEntry> query(IndexQuery query);
    IndexStats getStats();
}
