package com.vectorpipeline.search;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical search hit. {@code score} keeps the ordering convention of the index's distance
 * measure; {@code metadata} is null when neither the neighbor nor the metadata store had any.
 */
public record NeighborResult(String id, Double score, Map<String, Object> metadata) {
    public NeighborResult {
        metadata = metadata == null || metadata.isEmpty()
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasMetadata() {
        return metadata != null;
    }

    public NeighborResult withMetadata(Map<String, Object> backfilled) {
        return new NeighborResult(id, score, backfilled);
    }
}
