package com.vectorpipeline.search;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record SearchResponse(
        JsonNode query,
        @JsonProperty("query_type") String queryType,
        @JsonProperty("num_recommendations") int numRecommendations,
        List<NeighborResult> results) {

    public SearchResponse {
        results = List.copyOf(results);
    }
}
