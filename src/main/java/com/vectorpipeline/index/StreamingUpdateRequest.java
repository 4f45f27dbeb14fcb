package com.vectorpipeline.index;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Datapoints to upsert, taken either from {@code datapoints} ({@code source=api}) or from every
 * file under {@code datapointsPrefix} ({@code source=gcs}).
 */
public record StreamingUpdateRequest(String indexId, String source, List<JsonNode> datapoints, String datapointsPrefix) {
    public StreamingUpdateRequest {
        source = source == null || source.isBlank() ? "api" : source;
        datapoints = datapoints == null ? List.of() : List.copyOf(datapoints);
    }

    public boolean fromStorage() {
        return "gcs".equalsIgnoreCase(source);
    }
}
