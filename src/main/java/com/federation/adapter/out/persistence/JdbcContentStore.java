package com.federation.adapter.out.persistence;

import com.federation.adapter.out.store.ContentHash;
import com.federation.application.port.out.ContentStore;
import com.federation.domain.model.ContentItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The local site's content collection in PostgreSQL. Change listeners run on the writing thread, after
 * the statement and inside the caller's transaction, so outbox writes they make commit or roll back with it.
 */
@Repository
public class JdbcContentStore implements ContentStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcContentStore.class);

    private static final String COLUMNS =
        "id, name, category_id, content_locator, thumbnail_locator, metadata, federated_from, federated_at, federated_realtime";

    private static final RowMapper<ContentItem> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp federatedAt = rs.getTimestamp("federated_at");
        return new ContentItem(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("category_id"),
            rs.getString("content_locator"),
            rs.getString("thumbnail_locator"),
            rs.getString("metadata"),
            rs.getString("federated_from"),
            federatedAt != null ? federatedAt.toInstant() : null,
            rs.getObject("federated_realtime", Boolean.class)
        );
    };

    private final JdbcTemplate jdbc;
    private final List<ContentChangeListener> listeners = new CopyOnWriteArrayList<>();

    public JdbcContentStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public PutResult put(ContentItem item) {
        Optional<ContentItem> previous = get(item.id());
        jdbc.update("""
            INSERT INTO content_items (id, name, category_id, content_locator, thumbnail_locator, metadata,
                                       federated_from, federated_at, federated_realtime, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, NOW())
            ON CONFLICT (id) DO UPDATE SET
                name = EXCLUDED.name,
                category_id = EXCLUDED.category_id,
                content_locator = EXCLUDED.content_locator,
                thumbnail_locator = EXCLUDED.thumbnail_locator,
                metadata = EXCLUDED.metadata,
                federated_from = EXCLUDED.federated_from,
                federated_at = EXCLUDED.federated_at,
                federated_realtime = EXCLUDED.federated_realtime,
                updated_at = NOW()
            """,
            item.id(),
            item.name(),
            item.categoryId(),
            item.contentLocator(),
            item.thumbnailLocator(),
            item.metadata(),
            item.federatedFrom(),
            item.federatedAt() != null ? Timestamp.from(item.federatedAt()) : null,
            item.federatedRealtime()
        );
        if (previous.isEmpty() || !previous.get().equals(item)) {
            emit(List.of(item), List.of());
        }
        return new PutResult(ContentHash.of(item));
    }

    @Override
    public Optional<ContentItem> del(String id) {
        Optional<ContentItem> removed = jdbc.query(
            "DELETE FROM content_items WHERE id = ? RETURNING " + COLUMNS,
            ROW_MAPPER,
            id
        ).stream().findFirst();
        removed.ifPresent(item -> emit(List.of(), List.of(item)));
        return removed;
    }

    @Override
    public Optional<ContentItem> get(String id) {
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM content_items WHERE id = ?",
            ROW_MAPPER,
            id
        ).stream().findFirst();
    }

    @Override
    public List<ContentItem> search(ContentQuery query) {
        return page(query, null, query.limit());
    }

    @Override
    public ContentCursor iterate(ContentQuery query) {
        return new KeysetCursor(query);
    }

    @Override
    public ChangeSubscription onChange(ContentChangeListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private List<ContentItem> page(ContentQuery query, String afterId, int limit) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM content_items WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (query.originalsOnly()) {
            sql.append(" AND federated_from IS NULL");
        }
        if (query.federatedFrom() != null) {
            sql.append(" AND federated_from = ?");
            args.add(query.federatedFrom());
        }
        if (afterId != null) {
            sql.append(" AND id > ?");
            args.add(afterId);
        }
        sql.append(" ORDER BY id");
        if (limit != ContentQuery.UNBOUNDED) {
            sql.append(" LIMIT ?");
            args.add(limit);
        }
        return jdbc.query(sql.toString(), ROW_MAPPER, args.toArray());
    }

    private void emit(List<ContentItem> added, List<ContentItem> removed) {
        for (ContentChangeListener listener : listeners) {
            try {
                listener.onChange(added, removed);
            } catch (RuntimeException e) {
                log.error("Change listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private final class KeysetCursor implements ContentCursor {
        private final ContentQuery query;
        private String lastId;
        private boolean exhausted;

        private KeysetCursor(ContentQuery query) {
            this.query = query;
        }

        @Override
        public List<ContentItem> next(int batchSize) {
            if (exhausted) {
                return List.of();
            }
            List<ContentItem> batch = page(query, lastId, batchSize);
            if (batch.size() < batchSize) {
                exhausted = true;
            }
            if (!batch.isEmpty()) {
                lastId = batch.get(batch.size() - 1).id();
            }
            return batch;
        }

        @Override
        public boolean done() {
            return exhausted;
        }

        @Override
        public void close() {
            exhausted = true;
        }
    }
}
