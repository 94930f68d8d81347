package com.federation.domain.event;

import com.federation.domain.model.ContentItem;
import com.federation.domain.model.SiteAddress;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The local content collection changed. Its serialized form is the update message
 * other sites receive on this site's update topic.
 */
public record SiteContentChanged(
    UUID eventId,
    String siteId,
    String siteName,
    List<ContentItem> added,
    List<ContentItem> removed,
    Instant timestamp
) implements DomainEvent {

    public static final String TYPE = "SITE_CONTENT_CHANGED";

    public static SiteContentChanged from(UUID eventId, SiteAddress siteId, String siteName,
                                          List<ContentItem> added, List<ContentItem> removed, Instant now) {
        return new SiteContentChanged(eventId, siteId.value(), siteName, List.copyOf(added), List.copyOf(removed), now);
    }

    // The publishing site owns the update stream
    @Override
    public String aggregateId() {
        return siteId;
    }

    @Override
    public Instant occurredAt() {
        return timestamp;
    }

    @Override
    public String eventType() {
        return TYPE;
    }
}
