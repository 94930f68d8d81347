package com.federation.domain.model;

import com.federation.domain.error.ValidationError.ContentError;

import java.time.Instant;

/**
 * A unit of published content. When {@code federatedFrom} is set the item was imported and the
 * field names its original authoring site, not the relay it arrived through.
 *
 * @param metadata free-form JSON document, may be null
 */
public record ContentItem(
    String id,
    String name,
    String categoryId,
    String contentLocator,
    String thumbnailLocator,
    String metadata,
    String federatedFrom,
    Instant federatedAt,
    Boolean federatedRealtime
) {

    /**
     * Creates a local original, returning a Result for missing required fields.
     */
    public static Result<ContentItem, ContentError> create(
            String id,
            String name,
            String categoryId,
            String contentLocator,
            String thumbnailLocator,
            String metadata) {
        if (isBlank(id)) {
            return Result.failure(new ContentError.MissingField("id"));
        }
        if (isBlank(name)) {
            return Result.failure(new ContentError.MissingField("name"));
        }
        if (isBlank(categoryId)) {
            return Result.failure(new ContentError.MissingField("categoryId"));
        }
        if (isBlank(contentLocator)) {
            return Result.failure(new ContentError.MissingField("contentLocator"));
        }
        return Result.success(new ContentItem(id, name, categoryId, contentLocator,
            thumbnailLocator, metadata, null, null, null));
    }

    public static ContentItem original(String id, String name, String categoryId, String contentLocator) {
        return new ContentItem(id, name, categoryId, contentLocator, null, null, null, null, null);
    }

    public boolean federated() {
        return !isBlank(federatedFrom);
    }

    /**
     * Returns the imported copy: provenance kept when already present, otherwise the relaying site.
     */
    public ContentItem federate(SiteAddress relay, Instant now, boolean realtime) {
        String origin = federated() ? federatedFrom : relay.value();
        return new ContentItem(id, name, categoryId, contentLocator, thumbnailLocator, metadata,
            origin, now, realtime);
    }

    /**
     * The site this item should be attributed to when received through {@code relay}.
     */
    public String originVia(SiteAddress relay) {
        return federated() ? federatedFrom : relay.value();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
