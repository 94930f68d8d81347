package com.federation.application.port.out;

import com.federation.domain.model.ContentItem;

import java.util.List;
import java.util.Optional;

/**
 * A site's content collection. Implementations sit in front of a replicated document store
 * and may throw {@link com.federation.infrastructure.exception.StoreException} subclasses.
 */
public interface ContentStore {

    PutResult put(ContentItem item);

    /**
     * Deletes by id. Returns the removed item, if there was one.
     */
    Optional<ContentItem> del(String id);

    Optional<ContentItem> get(String id);

    List<ContentItem> search(ContentQuery query);

    ContentCursor iterate(ContentQuery query);

    /**
     * Registers a change listener. Events are emitted after the write is visible.
     */
    ChangeSubscription onChange(ContentChangeListener listener);

    record PutResult(String hash) {}

    /**
     * Filter for search and iterate. {@code originalsOnly} keeps items without provenance;
     * {@code federatedFrom} keeps items imported from exactly that origin.
     */
    record ContentQuery(boolean originalsOnly, String federatedFrom, int limit) {

        public static final int UNBOUNDED = Integer.MAX_VALUE;

        public static ContentQuery all() {
            return new ContentQuery(false, null, UNBOUNDED);
        }

        public static ContentQuery originals() {
            return new ContentQuery(true, null, UNBOUNDED);
        }

        public static ContentQuery federatedFrom(String origin) {
            return new ContentQuery(false, origin, UNBOUNDED);
        }

        public boolean matches(ContentItem item) {
            if (originalsOnly && item.federated()) {
                return false;
            }
            return federatedFrom == null || federatedFrom.equals(item.federatedFrom());
        }
    }

    interface ContentCursor extends AutoCloseable {
        List<ContentItem> next(int batchSize);

        boolean done();

        @Override
        void close();
    }

    @FunctionalInterface
    interface ContentChangeListener {
        void onChange(List<ContentItem> added, List<ContentItem> removed);
    }

    @FunctionalInterface
    interface ChangeSubscription extends AutoCloseable {
        @Override
        void close();
    }
}
