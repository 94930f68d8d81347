package com.federation.adapter.out.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.federation.application.port.out.FederationIndexRepository;
import com.federation.domain.model.FederationIndexEntry;
import com.federation.domain.model.NodeIdentity;
import com.federation.infrastructure.exception.StoreCorruptedException;
import com.federation.infrastructure.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Federation index kept in Redis: a hash of id to entry JSON and a sorted set of ids scored by timestamp.
 * Keys are scoped by the owning node's address.
 */
@Repository
public class RedisFederationIndexRepository implements FederationIndexRepository {

    private static final Logger log = LoggerFactory.getLogger(RedisFederationIndexRepository.class);
    private static final String INDEX_KEY_PREFIX = "federation-index:";

    private final HashOperations<String, String, String> hashOps;
    private final ZSetOperations<String, String> zSetOps;
    private final ObjectMapper objectMapper;
    private final String entriesKey;
    private final String byTimeKey;

    public RedisFederationIndexRepository(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            NodeIdentity nodeIdentity) {
        this.hashOps = redisTemplate.opsForHash();
        this.zSetOps = redisTemplate.opsForZSet();
        this.objectMapper = objectMapper;
        String prefix = INDEX_KEY_PREFIX + nodeIdentity.address().value();
        this.entriesKey = prefix + ":entries";
        this.byTimeKey = prefix + ":by-time";
    }

    @Override
    public boolean put(FederationIndexEntry entry) {
        boolean existed = hashOps.hasKey(entriesKey, entry.id());
        hashOps.put(entriesKey, entry.id(), toJson(entry));
        zSetOps.add(byTimeKey, entry.id(), score(entry));
        log.debug("Stored index entry {}", entry.id());
        return !existed;
    }

    @Override
    public boolean delete(String id) {
        Long removed = hashOps.delete(entriesKey, id);
        zSetOps.remove(byTimeKey, id);
        return removed != null && removed > 0;
    }

    @Override
    public boolean exists(String id) {
        return hashOps.hasKey(entriesKey, id);
    }

    @Override
    public Optional<FederationIndexEntry> findById(String id) {
        return Optional.ofNullable(hashOps.get(entriesKey, id)).map(this::fromJson);
    }

    @Override
    public List<FederationIndexEntry> findAll() {
        Set<String> ids = zSetOps.reverseRange(byTimeKey, 0, -1); // newest first
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<String> payloads = hashOps.multiGet(entriesKey, new ArrayList<>(ids));
        return payloads.stream()
            .filter(Objects::nonNull)
            .map(this::fromJson)
            .toList();
    }

    @Override
    public int deleteBySourceSite(String sourceSiteId) {
        List<String> ids = findAll().stream()
            .filter(entry -> sourceSiteId.equals(entry.sourceSiteId()))
            .map(FederationIndexEntry::id)
            .toList();
        if (ids.isEmpty()) {
            return 0;
        }
        hashOps.delete(entriesKey, ids.toArray());
        zSetOps.remove(byTimeKey, ids.toArray());
        log.info("Removed {} index entries from source {}", ids.size(), sourceSiteId);
        return ids.size();
    }

    private static double score(FederationIndexEntry entry) {
        return entry.timestamp() != null ? entry.timestamp().toEpochMilli() : 0;
    }

    private String toJson(FederationIndexEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize index entry " + entry.id(), e);
        }
    }

    private FederationIndexEntry fromJson(String payload) {
        try {
            return objectMapper.readValue(payload, FederationIndexEntry.class);
        } catch (JsonProcessingException e) {
            throw new StoreCorruptedException("Unreadable index entry: " + e.getOriginalMessage(), e);
        }
    }
}
