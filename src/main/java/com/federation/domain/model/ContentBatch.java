package com.federation.domain.model;

import java.util.List;

/**
 * One delivery from a transport: items added and removed at the remote site.
 * {@code realtime} is true for live change deliveries and false for initial, historical and scan passes.
 */
public record ContentBatch(List<ContentItem> added, List<ContentItem> removed, boolean realtime) {

    public ContentBatch {
        added = added == null ? List.of() : List.copyOf(added);
        removed = removed == null ? List.of() : List.copyOf(removed);
    }

    public static ContentBatch live(List<ContentItem> added, List<ContentItem> removed) {
        return new ContentBatch(added, removed, true);
    }

    public static ContentBatch snapshot(List<ContentItem> items) {
        return new ContentBatch(items, List.of(), false);
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }

    public int size() {
        return added.size() + removed.size();
    }
}
