package com.federation.domain.model;

import java.time.Instant;
import java.util.Map;

public record IndexStats(
    long totalEntries,
    Map<String, Long> entriesBySite,
    Map<String, Long> entriesByType,
    Instant oldest,
    Instant newest
) {

    public static IndexStats empty() {
        return new IndexStats(0, Map.of(), Map.of(), null, null);
    }
}
