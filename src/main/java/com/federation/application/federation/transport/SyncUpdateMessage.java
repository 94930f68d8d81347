package com.federation.application.federation.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.federation.domain.model.ContentItem;

import java.time.Instant;
import java.util.List;

/**
 * Update a site broadcasts on its own topic after its collection changes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncUpdateMessage(
    String siteId,
    String siteName,
    List<ContentItem> added,
    List<ContentItem> removed,
    Instant timestamp
) {
    public SyncUpdateMessage {
        added = added == null ? List.of() : added;
        removed = removed == null ? List.of() : removed;
    }
}
