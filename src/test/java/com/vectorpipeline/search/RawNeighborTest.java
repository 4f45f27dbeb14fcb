package com.vectorpipeline.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

class RawNeighborTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldNormalizeNestedNeighborWithoutMetadata() throws Exception {
        RawNeighbor neighbor = RawNeighbor.decode(
                mapper.readTree("{\"distance\":0.5,\"datapoint\":{\"datapoint_id\":\"x\"}}"), mapper);

        assertInstanceOf(RawNeighbor.Nested.class, neighbor);
        assertEquals(new NeighborResult("x", 0.5, null), neighbor.toResult());
    }

    @Test
    void shouldReadNestedAliasesAndMetadata() throws Exception {
        NeighborResult result = RawNeighbor.decode(mapper.readTree(
                "{\"score\":0.9,\"datapoint\":{\"id\":\"y\",\"metadata\":{\"title\":\"t\"}}}"), mapper).toResult();

        assertEquals("y", result.id());
        assertEquals(0.9, result.score());
        assertEquals(Map.of("title", "t"), result.metadata());
    }

    @Test
    void shouldNormalizeFlatNeighborAndTreatEmptyMetadataAsMissing() throws Exception {
        RawNeighbor neighbor = RawNeighbor.decode(mapper.readTree("{\"id\":\"z\",\"embedding_metadata\":{}}"), mapper);

        assertInstanceOf(RawNeighbor.Flat.class, neighbor);
        assertNull(neighbor.score());
        assertNull(neighbor.toResult().metadata());
    }

    @Test
    void shouldFallBackToTopLevelIdWhenDatapointHasNone() throws Exception {
        NeighborResult result = RawNeighbor.decode(mapper.readTree(
                "{\"id\":\"x\",\"distance\":0.2,\"datapoint\":{\"embedding_metadata\":{\"title\":\"t\"}}}"), mapper)
                .toResult();

        assertEquals(new NeighborResult("x", 0.2, Map.of("title", "t")), result);
    }

    @Test
    void shouldFallBackToTopLevelMetadataWhenDatapointHasNone() throws Exception {
        NeighborResult result = RawNeighbor.decode(mapper.readTree(
                "{\"metadata\":{\"t\":1},\"datapoint\":{\"datapoint_id\":\"x\"}}"), mapper).toResult();

        assertEquals("x", result.id());
        assertEquals(Map.of("t", 1), result.metadata());
    }

    @Test
    void shouldPreferNestedIdAndMetadataOverTopLevel() throws Exception {
        NeighborResult result = RawNeighbor.decode(mapper.readTree("""
                {"id":"outer","metadata":{"title":"outer"},
                 "datapoint":{"datapoint_id":"inner","embedding_metadata":{"title":"inner"}}}
                """), mapper).toResult();

        assertEquals("inner", result.id());
        assertEquals(Map.of("title", "inner"), result.metadata());
    }

    @Test
    void shouldPreferDistanceOverScore() throws Exception {
        RawNeighbor neighbor = RawNeighbor.decode(mapper.readTree("{\"id\":\"z\",\"distance\":1.5,\"score\":9}"), mapper);

        assertEquals(1.5, neighbor.score());
    }

    @Test
    void shouldRejectUnrecognizedShapes() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> RawNeighbor.decode(mapper.readTree("{\"distance\":0.1}"), mapper));
        assertThrows(IllegalArgumentException.class,
                () -> RawNeighbor.decode(mapper.readTree("{\"datapoint\":{\"title\":\"no id\"}}"), mapper));
        assertThrows(IllegalArgumentException.class, () -> RawNeighbor.decode(mapper.readTree("[1]"), mapper));
    }
}
