package com.vectorpipeline.index;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.vectorpipeline.ingest.IndexEntry;

/**
 * The vector-search service the pipeline writes to and queries. Neighbors come back as raw JSON
 * whose shape depends on the service and on whether full datapoints were requested.
 */
public interface VectorSearchService {
    void upsert(Collection<IndexEntry> entries) throws IOException;

    void overwrite(Collection<IndexEntry> entries) throws IOException;

    void remove(Collection<String> ids) throws IOException;

    List<List<JsonNode>> findNeighbors(List<NeighborQuery> queries) throws IOException;
}
