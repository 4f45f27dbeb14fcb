package com.vectorpipeline.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Search parameters. Null {@code topK}, {@code metadataPrefix}, {@code endpointId} and
 * {@code deployedIndexId} fall back to configuration.
 */
public record SearchRequest(
        String queryType,
        JsonNode query,
        Integer topK,
        boolean hybrid,
        JsonNode restricts,
        String metadataPrefix,
        String endpointId,
        String deployedIndexId) {

    public static SearchRequest text(String text, int topK) {
        return new SearchRequest("text", TextNode.valueOf(text), topK, false, null,
                null, null, null);
    }
}
