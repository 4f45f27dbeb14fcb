package com.vectorpipeline.index;

import java.util.List;

import com.vectorpipeline.ingest.TermBucketVector;

/**
 * One nearest-neighbor query. {@code sparseVector} is null for dense-only queries.
 */
public record NeighborQuery(
        float[] denseVector,
        TermBucketVector sparseVector,
        int numNeighbors,
        List<NamespaceFilter> filters,
        boolean returnFullDatapoint) {

    public NeighborQuery {
        if (denseVector == null || denseVector.length == 0) {
            throw new IllegalArgumentException("Neighbor query requires a dense vector");
        }
        if (numNeighbors <= 0) {
            throw new IllegalArgumentException("numNeighbors must be > 0, got " + numNeighbors);
        }
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public boolean isHybrid() {
        return sparseVector != null && sparseVector.hasSignal();
    }
}
