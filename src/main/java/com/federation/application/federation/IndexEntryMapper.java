package com.federation.application.federation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.FederationIndexEntry;
import com.federation.domain.model.FollowEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a remote content item into a federation index pointer.
 * Optional fields come from the item's metadata document; unreadable metadata falls back to defaults.
 */
public class IndexEntryMapper {

    private static final Logger log = LoggerFactory.getLogger(IndexEntryMapper.class);

    private final ObjectMapper objectMapper;

    public IndexEntryMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String entryIdFor(ContentItem item, FollowEdge edge) {
        return FederationIndexEntry.idFor(item.originVia(edge.targetAddress()), item.contentLocator());
    }

    public FederationIndexEntry toEntry(ContentItem item, FollowEdge edge, Instant now) {
        String sourceSiteId = item.originVia(edge.targetAddress());
        String sourceSiteName = edge.targetAddress().matches(sourceSiteId) ? edge.displayName() : sourceSiteId;
        JsonNode metadata = readMetadata(item);

        return new FederationIndexEntry(
            FederationIndexEntry.idFor(sourceSiteId, item.contentLocator()),
            item.contentLocator(),
            blankToDefault(item.name(), FederationIndexEntry.DEFAULT_TITLE),
            item.thumbnailLocator(),
            blankToDefault(item.categoryId(), FederationIndexEntry.DEFAULT_CATEGORY),
            sourceSiteId,
            sourceSiteName,
            blankToDefault(text(metadata, "contentType"), FederationIndexEntry.DEFAULT_CONTENT_TYPE),
            text(metadata, "description"),
            now,
            tags(metadata),
            metadata.path("isFeatured").asBoolean(false),
            metadata.path("isPromoted").asBoolean(false),
            instant(metadata, "featuredUntil"),
            instant(metadata, "promotedUntil")
        );
    }

    private JsonNode readMetadata(ContentItem item) {
        if (item.metadata() == null || item.metadata().isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(item.metadata());
            return node != null && node.isObject() ? node : objectMapper.createObjectNode();
        } catch (IOException e) {
            log.warn("Ignoring unreadable metadata on {}: {}", item.id(), e.getMessage());
            return objectMapper.createObjectNode();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static List<String> tags(JsonNode node) {
        JsonNode value = node.get("tags");
        if (value == null || !value.isArray()) {
            return List.of();
        }
        List<String> tags = new ArrayList<>();
        value.forEach(tag -> {
            if (tag.isTextual()) {
                tags.add(tag.asText());
            }
        });
        return tags;
    }

    private static Instant instant(JsonNode node, String field) {
        String raw = text(node, field);
        if (raw == null) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
