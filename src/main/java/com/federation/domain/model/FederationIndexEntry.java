package com.federation.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Pointer to content held by another site. Carries no payload.
 * The id is a pure function of {@code (sourceSiteId, contentLocator)} so repeated inserts collapse.
 */
public record FederationIndexEntry(
    String id,
    String contentLocator,
    String title,
    String thumbnailLocator,
    String categoryId,
    String sourceSiteId,
    String sourceSiteName,
    String contentType,
    String description,
    Instant timestamp,
    List<String> tags,
    boolean featured,
    boolean promoted,
    Instant featuredUntil,
    Instant promotedUntil
) {

    public static final String DEFAULT_TITLE = "Untitled";
    public static final String DEFAULT_CATEGORY = "uncategorized";
    public static final String DEFAULT_CONTENT_TYPE = "video";

    public FederationIndexEntry {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static String idFor(String sourceSiteId, String contentLocator) {
        return sourceSiteId + ":" + contentLocator;
    }

    /**
     * Returns this entry with its id recomputed from source and locator.
     */
    public FederationIndexEntry withDeterministicId() {
        return new FederationIndexEntry(idFor(sourceSiteId, contentLocator), contentLocator, title,
            thumbnailLocator, categoryId, sourceSiteId, sourceSiteName, contentType, description,
            timestamp, tags, featured, promoted, featuredUntil, promotedUntil);
    }

    public boolean isFeaturedAt(Instant now) {
        return featured && (featuredUntil == null || featuredUntil.isAfter(now));
    }

    public boolean isPromotedAt(Instant now) {
        return promoted && (promotedUntil == null || promotedUntil.isAfter(now));
    }

    public boolean hasAnyTag(List<String> wanted) {
        return wanted.stream().anyMatch(tags::contains);
    }

    public boolean matchesText(String text) {
        String needle = text.toLowerCase(Locale.ROOT);
        return (title != null && title.toLowerCase(Locale.ROOT).contains(needle))
            || (description != null && description.toLowerCase(Locale.ROOT).contains(needle));
    }
}
