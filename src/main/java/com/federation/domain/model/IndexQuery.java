package com.federation.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Composite federation index query. Every non-null predicate must hold; tags match when any overlaps.
 * Results are ordered newest first and then sliced by {@code offset}/{@code limit}.
 */
public record IndexQuery(
    String text,
    String contentType,
    String sourceSiteId,
    String categoryId,
    List<String> tags,
    Instant after,
    Instant before,
    int limit,
    int offset
) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    public IndexQuery {
        tags = tags == null ? List.of() : List.copyOf(tags);
        limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        offset = Math.max(offset, 0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(FederationIndexEntry entry) {
        if (text != null && !text.isBlank() && !entry.matchesText(text)) {
            return false;
        }
        if (contentType != null && !contentType.equals(entry.contentType())) {
            return false;
        }
        if (sourceSiteId != null && !sourceSiteId.equals(entry.sourceSiteId())) {
            return false;
        }
        if (categoryId != null && !categoryId.equals(entry.categoryId())) {
            return false;
        }
        if (!tags.isEmpty() && !entry.hasAnyTag(tags)) {
            return false;
        }
        Instant ts = entry.timestamp();
        if (after != null && (ts == null || !ts.isAfter(after))) {
            return false;
        }
        return before == null || (ts != null && ts.isBefore(before));
    }

    public static final class Builder {
        private String text;
        private String contentType;
        private String sourceSiteId;
        private String categoryId;
        private List<String> tags = List.of();
        private Instant after;
        private Instant before;
        private int limit = DEFAULT_LIMIT;
        private int offset;

        private Builder() {
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder sourceSiteId(String sourceSiteId) {
            this.sourceSiteId = sourceSiteId;
            return this;
        }

        public Builder categoryId(String categoryId) {
            this.categoryId = categoryId;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder after(Instant after) {
            this.after = after;
            return this;
        }

        public Builder before(Instant before) {
            this.before = before;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public IndexQuery build() {
            return new IndexQuery(text, contentType, sourceSiteId, categoryId, tags, after, before, limit, offset);
        }
    }
}
