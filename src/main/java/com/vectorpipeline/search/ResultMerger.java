package com.vectorpipeline.search;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Turns raw neighbors into {@link NeighborResult}s and fills in metadata found elsewhere.
 * Metadata already attached to a result is never replaced.
 */
public class ResultMerger {
    private final ObjectMapper mapper;

    public ResultMerger(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<NeighborResult> normalize(List<JsonNode> neighbors) {
        List<NeighborResult> results = new ArrayList<>(neighbors.size());
        for (JsonNode neighbor : neighbors) {
            results.add(RawNeighbor.decode(neighbor, mapper).toResult());
        }
        return results;
    }

    public Set<String> missingMetadataIds(List<NeighborResult> results) {
        Set<String> ids = new LinkedHashSet<>();
        for (NeighborResult result : results) {
            if (!result.hasMetadata()) {
                ids.add(result.id());
            }
        }
        return ids;
    }

    public List<NeighborResult> applyBackfill(List<NeighborResult> results, Map<String, Map<String, Object>> found) {
        if (found.isEmpty()) {
            return results;
        }
        List<NeighborResult> merged = new ArrayList<>(results.size());
        for (NeighborResult result : results) {
            Map<String, Object> metadata = found.get(result.id());
            merged.add(!result.hasMetadata() && metadata != null ? result.withMetadata(metadata) : result);
        }
        return merged;
    }
}
