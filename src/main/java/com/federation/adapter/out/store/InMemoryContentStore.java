package com.federation.adapter.out.store;

import com.federation.application.port.out.ContentStore;
import com.federation.domain.model.ContentItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Content collection held in memory. Used as the full-mirror replica and for in-process sites.
 * Change events fire after the write, outside the store's lock; rewriting an identical item fires nothing.
 */
public class InMemoryContentStore implements ContentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryContentStore.class);

    private final Map<String, ContentItem> items = new LinkedHashMap<>();
    private final List<ContentChangeListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public PutResult put(ContentItem item) {
        ContentItem previous;
        synchronized (items) {
            previous = items.put(item.id(), item);
        }
        if (!item.equals(previous)) {
            emit(List.of(item), List.of());
        }
        return new PutResult(ContentHash.of(item));
    }

    @Override
    public Optional<ContentItem> del(String id) {
        ContentItem removed;
        synchronized (items) {
            removed = items.remove(id);
        }
        if (removed != null) {
            emit(List.of(), List.of(removed));
        }
        return Optional.ofNullable(removed);
    }

    @Override
    public Optional<ContentItem> get(String id) {
        synchronized (items) {
            return Optional.ofNullable(items.get(id));
        }
    }

    @Override
    public List<ContentItem> search(ContentQuery query) {
        synchronized (items) {
            return items.values().stream()
                .filter(query::matches)
                .limit(query.limit())
                .toList();
        }
    }

    @Override
    public ContentCursor iterate(ContentQuery query) {
        return new SnapshotCursor(search(query));
    }

    @Override
    public ChangeSubscription onChange(ContentChangeListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int size() {
        synchronized (items) {
            return items.size();
        }
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

    private static final class SnapshotCursor implements ContentCursor {
        private final List<ContentItem> snapshot;
        private int position;

        private SnapshotCursor(List<ContentItem> snapshot) {
            this.snapshot = new ArrayList<>(snapshot);
        }

        @Override
        public List<ContentItem> next(int batchSize) {
            int end = Math.min(position + batchSize, snapshot.size());
            List<ContentItem> batch = List.copyOf(snapshot.subList(position, end));
            position = end;
            return batch;
        }

        @Override
        public boolean done() {
            return position >= snapshot.size();
        }

        @Override
        public void close() {
            position = snapshot.size();
        }
    }
}
