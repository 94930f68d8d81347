package com.federation.application.service;

import com.federation.application.port.in.QueryFederationIndexUseCase;
import com.federation.application.port.in.WriteFederationIndexUseCase;
import com.federation.application.port.out.FederationIndexRepository;
import com.federation.domain.error.IndexWriteError;
import com.federation.domain.model.FederationIndexEntry;
import com.federation.domain.model.IndexQuery;
import com.federation.domain.model.IndexStats;
import com.federation.domain.model.Result;
import com.federation.infrastructure.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Access-controlled pointer cache for cross-site discovery.
 * Reads are best effort: a missing or corrupted backing store yields empty results, never an error.
 */
@Service
public class FederationIndexService implements QueryFederationIndexUseCase, WriteFederationIndexUseCase {

    private static final Logger log = LoggerFactory.getLogger(FederationIndexService.class);

    private static final Comparator<FederationIndexEntry> NEWEST_FIRST = Comparator.comparing(
        FederationIndexEntry::timestamp, Comparator.nullsLast(Comparator.reverseOrder()));

    private final FederationIndexRepository repository;
    private final IndexWritePolicy writePolicy;
    private final Clock clock;

    public FederationIndexService(FederationIndexRepository repository, IndexWritePolicy writePolicy, Clock clock) {
        this.repository = repository;
        this.writePolicy = writePolicy;
        this.clock = clock;
    }

    @Override
    public Result<FederationIndexEntry, IndexWriteError> insert(FederationIndexEntry entry, String actorKey) {
        if (!writePolicy.permits(actorKey)) {
            return Result.failure(new IndexWriteError.Denied(actorKey));
        }
        if (isBlank(entry.sourceSiteId()) || isBlank(entry.contentLocator())) {
            return Result.failure(new IndexWriteError.Invalid("sourceSiteId and contentLocator are required"));
        }
        FederationIndexEntry normalized = entry.withDeterministicId();
        boolean created = repository.put(normalized);
        log.debug("Index entry {} {}", normalized.id(), created ? "inserted" : "replaced");
        return Result.success(normalized);
    }

    @Override
    public Result<Void, IndexWriteError> remove(String entryId, String actorKey) {
        if (!writePolicy.permits(actorKey)) {
            return Result.failure(new IndexWriteError.Denied(actorKey));
        }
        if (!repository.delete(entryId)) {
            return Result.failure(new IndexWriteError.NotFound(entryId));
        }
        log.debug("Index entry {} removed", entryId);
        return Result.ok();
    }

    @Override
    public List<FederationIndexEntry> getRecent(int limit, int offset) {
        return query(IndexQuery.builder().limit(limit).offset(offset).build());
    }

    @Override
    public List<FederationIndexEntry> getByCategory(String categoryId) {
        return filter(e -> Objects.equals(categoryId, e.categoryId()));
    }

    @Override
    public List<FederationIndexEntry> getByTags(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        return filter(e -> e.hasAnyTag(tags));
    }

    @Override
    public List<FederationIndexEntry> getBySourceSite(String sourceSiteId) {
        return filter(e -> Objects.equals(sourceSiteId, e.sourceSiteId()));
    }

    @Override
    public List<FederationIndexEntry> search(String text) {
        if (isBlank(text)) {
            return List.of();
        }
        return filter(e -> e.matchesText(text.trim()));
    }

    @Override
    public List<FederationIndexEntry> getByTimeRange(Instant after, Instant before) {
        return filter(e -> e.timestamp() != null
            && (after == null || e.timestamp().isAfter(after))
            && (before == null || e.timestamp().isBefore(before)));
    }

    @Override
    public List<FederationIndexEntry> getFeatured() {
        Instant now = clock.instant();
        return filter(e -> e.isFeaturedAt(now));
    }

    @Override
    public List<FederationIndexEntry> getPromoted() {
        Instant now = clock.instant();
        return filter(e -> e.isPromotedAt(now));
    }

    @Override
    public List<FederationIndexEntry> query(IndexQuery query) {
        return allEntries().stream()
            .filter(query::matches)
            .sorted(NEWEST_FIRST)
            .skip(query.offset())
            .limit(query.limit())
            .toList();
    }

    @Override
    public IndexStats getStats() {
        List<FederationIndexEntry> entries = allEntries();
        if (entries.isEmpty()) {
            return IndexStats.empty();
        }
        Map<String, Long> bySite = new TreeMap<>();
        Map<String, Long> byType = new TreeMap<>();
        Instant oldest = null;
        Instant newest = null;
        for (FederationIndexEntry entry : entries) {
            bySite.merge(String.valueOf(entry.sourceSiteId()), 1L, Long::sum);
            byType.merge(String.valueOf(entry.contentType()), 1L, Long::sum);
            Instant ts = entry.timestamp();
            if (ts != null) {
                oldest = oldest == null || ts.isBefore(oldest) ? ts : oldest;
                newest = newest == null || ts.isAfter(newest) ? ts : newest;
            }
        }
        return new IndexStats(entries.size(), bySite, byType, oldest, newest);
    }

    private List<FederationIndexEntry> filter(Predicate<FederationIndexEntry> predicate) {
        return allEntries().stream().filter(predicate).sorted(NEWEST_FIRST).toList();
    }

    private List<FederationIndexEntry> allEntries() {
        try {
            return repository.findAll();
        } catch (StoreException | DataAccessException e) {
            log.warn("Federation index unreadable, returning no entries: {}", e.getMessage());
            return List.of();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
