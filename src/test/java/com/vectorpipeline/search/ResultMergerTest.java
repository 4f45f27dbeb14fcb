package com.vectorpipeline.search;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

class ResultMergerTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final ResultMerger merger = new ResultMerger(mapper);

    @Test
    void shouldNormalizeMixedNeighborShapesInOrder() throws Exception {
        List<NeighborResult> results = merger.normalize(List.of(
                mapper.readTree("{\"distance\":0.9,\"datapoint\":{\"datapoint_id\":\"a\",\"embedding_metadata\":{\"t\":1}}}"),
                mapper.readTree("{\"id\":\"b\",\"score\":0.4}")));

        assertEquals(List.of(new NeighborResult("a", 0.9, Map.of("t", 1)), new NeighborResult("b", 0.4, null)), results);
        assertEquals(Set.of("b"), merger.missingMetadataIds(results));
    }

    @Test
    void shouldNeverOverwriteExistingMetadata() {
        List<NeighborResult> results = List.of(
                new NeighborResult("a", 1.0, Map.of("title", "from index")),
                new NeighborResult("b", 0.5, null));

        List<NeighborResult> merged = merger.applyBackfill(results, Map.of(
                "a", Map.of("title", "from storage"),
                "b", Map.of("title", "backfilled")));

        assertEquals(Map.of("title", "from index"), merged.get(0).metadata());
        assertEquals(Map.of("title", "backfilled"), merged.get(1).metadata());
        assertEquals(0.5, merged.get(1).score());
    }

    @Test
    void shouldLeaveResultsWithoutBackfillUntouched() {
        List<NeighborResult> results = List.of(new NeighborResult("a", null, null));

        assertEquals(results, merger.applyBackfill(results, Map.of("other", Map.of("x", 1))));
    }
}
