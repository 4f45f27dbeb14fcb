package com.vectorpipeline.search;

import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The two neighbor shapes returned by the vector-search service: full datapoints nest id and
 * metadata under {@code datapoint}, id-only results carry them at the top level.
 */
public sealed interface RawNeighbor permits RawNeighbor.Nested, RawNeighbor.Flat {
    TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    String id();

    Map<String, Object> metadata();

    Double score();

    default NeighborResult toResult() {
        return new NeighborResult(id(), score(), metadata());
    }

    record Nested(String id, Map<String, Object> metadata, Double score) implements RawNeighbor {
    }

    record Flat(String id, Map<String, Object> metadata, Double score) implements RawNeighbor {
    }

    static RawNeighbor decode(JsonNode neighbor, ObjectMapper mapper) {
        if (neighbor == null || !neighbor.isObject()) {
            throw new IllegalArgumentException("Neighbor is not an object: " + neighbor);
        }
        Double score = score(neighbor);
        JsonNode datapoint = neighbor.get("datapoint");
        String flatId = text(neighbor, "id", "datapoint_id");
        Map<String, Object> flatMetadata = metadata(neighbor, mapper);
        if (datapoint != null && datapoint.isObject()) {
            // nested fields win, top-level ones fill what the datapoint lacks
            String nestedId = text(datapoint, "datapoint_id", "id");
            Map<String, Object> nestedMetadata = metadata(datapoint, mapper);
            String id = nestedId != null ? nestedId : flatId;
            if (id == null) {
                throw new IllegalArgumentException("Nested neighbor has no datapoint id: " + neighbor);
            }
            return new Nested(id, nestedMetadata != null ? nestedMetadata : flatMetadata, score);
        }
        if (flatId == null) {
            throw new IllegalArgumentException("Unrecognized neighbor shape: " + neighbor);
        }
        return new Flat(flatId, flatMetadata, score);
    }

    private static Double score(JsonNode neighbor) {
        if (neighbor.hasNonNull("distance")) {
            return neighbor.get("distance").asDouble();
        }
        if (neighbor.hasNonNull("score")) {
            return neighbor.get("score").asDouble();
        }
        return null;
    }

    private static String text(JsonNode node, String name, String alias) {
        for (String field : new String[] { name, alias }) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return null;
    }

    private static Map<String, Object> metadata(JsonNode node, ObjectMapper mapper) {
        for (String field : new String[] { "embedding_metadata", "metadata" }) {
            JsonNode value = node.get(field);
            if (value != null && value.isObject() && !value.isEmpty()) {
                return mapper.convertValue(value, MAP_TYPE);
            }
        }
        return null;
    }
}
