package com.vectorpipeline.search;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A validated search query: either text to embed or a ready dense vector, never both.
 */
public record QueryInput(QueryType type, String text, float[] vector) {

    public static QueryInput of(QueryType type, JsonNode query) {
        if (query == null || query.isNull() || query.isMissingNode()) {
            throw new IllegalArgumentException("query is required");
        }
        if (query.isObject()) {
            boolean hasText = query.has("text");
            boolean hasVector = query.has("vector");
            if (hasText && hasVector) {
                throw new IllegalArgumentException("query must be either text or a vector, not both");
            }
            if (hasText) {
                return of(type, query.get("text"));
            }
            if (hasVector) {
                return of(type, query.get("vector"));
            }
            throw new IllegalArgumentException("query object must contain 'text' or 'vector'");
        }
        if (type == QueryType.TEXT) {
            if (!query.isTextual()) {
                throw new IllegalArgumentException("text query must be a string");
            }
            if (query.asText().isBlank()) {
                throw new IllegalArgumentException("text query must not be blank");
            }
            return new QueryInput(type, query.asText(), null);
        }
        if (!query.isArray() || query.isEmpty()) {
            throw new IllegalArgumentException("vector query must be a non-empty array of numbers");
        }
        float[] vector = new float[query.size()];
        for (int i = 0; i < vector.length; i++) {
            JsonNode value = query.get(i);
            if (!value.isNumber()) {
                throw new IllegalArgumentException("vector query element " + i + " is not a number: " + value);
            }
            vector[i] = (float) value.asDouble();
        }
        return new QueryInput(type, null, vector);
    }

    public boolean isText() {
        return type == QueryType.TEXT;
    }
}
