package com.vectorpipeline.index;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vectorpipeline.ingest.DatapointAssembler;
import com.vectorpipeline.ingest.IndexEntry;
import com.vectorpipeline.runtime.PipelineException;
import com.vectorpipeline.runtime.PipelineStage;
import com.vectorpipeline.storage.LocalBlobStore;

class IndexUpdateServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final DatapointAssembler assembler = new DatapointAssembler(mapper);
    private LocalJsonVectorIndex index;
    private IndexUpdateService service;

    @BeforeEach
    void setUp() throws IOException {
        Path batch = tempDir.resolve("bucket/batch");
        Files.createDirectories(batch);
        Files.writeString(batch.resolve("part-00000.json"), """
                {"id":"1","embedding":[1,0],"embedding_metadata":{"title":"one"}}
                not json at all
                {"id":"2","embedding":[0,1]}
                """);
        Files.writeString(batch.resolve("part-00001.json"), """
                {"id":"1","embedding":[0.5,0.5],"embedding_metadata":{"title":"one v2"}}
                """);
        index = new LocalJsonVectorIndex(DistanceMeasure.DOT_PRODUCT, mapper);
        service = service(index);
    }

    @Test
    void shouldUpsertDatapointsFromRequestBody() throws Exception {
        List<JsonNode> datapoints = List.of(
                mapper.readTree("{\"id\":\"a\",\"embedding\":[1,2]}"),
                mapper.readTree("{\"id\":\"b\",\"embedding\":[3,4],\"restricts\":[{\"namespace\":\"c\",\"allow\":[\"x\"]}]}"));

        UpdateReport report = service.streamingUpdate(new StreamingUpdateRequest(null, "api", datapoints, null));

        assertEquals(new UpdateReport("idx", 2, 0), report);
        assertEquals("x", index.get("b").restricts().get(0).allow().get(0));
    }

    @Test
    void shouldRejectDuplicateIdsInRequestBody() throws Exception {
        List<JsonNode> datapoints = List.of(
                mapper.readTree("{\"id\":\"a\",\"embedding\":[1]}"),
                mapper.readTree("{\"id\":\"a\",\"embedding\":[2]}"));

        assertThrows(IllegalArgumentException.class,
                () -> service.streamingUpdate(new StreamingUpdateRequest("idx", "api", datapoints, null)));
        assertEquals(0, index.size());
    }

    @Test
    void shouldRejectRequestDatapointsWithoutIdOrEmbedding() throws Exception {
        List<JsonNode> datapoints = List.of(mapper.readTree("{\"id\":\"\"}"), mapper.readTree("{\"id\":\"b\"}"));

        assertThrows(IllegalArgumentException.class,
                () -> service.streamingUpdate(new StreamingUpdateRequest("idx", "api", datapoints, null)));
        assertEquals(0, index.size());
    }

    @Test
    void shouldSkipStoredDatapointsThatBreakEntryRules() throws IOException {
        Path broken = tempDir.resolve("bucket/broken");
        Files.createDirectories(broken);
        Files.writeString(broken.resolve("part-00000.json"), """
                {"id":"","embedding":[1,0]}
                {"id":"no-vector"}
                {"id":"too-long","embedding":[1,0,0]}
                {"id":"ok","embedding":[1,0]}
                """);
        DatapointAssembler twoDimensional = new DatapointAssembler(mapper, 2);
        IndexUpdateService checked = new IndexUpdateService(index,
                new DatapointLoader(new LocalBlobStore(tempDir), twoDimensional), twoDimensional, "idx", null);

        UpdateReport report = checked.streamingUpdate(new StreamingUpdateRequest(null, "gcs", null, "gs://bucket/broken"));

        assertEquals(new UpdateReport("idx", 1, 3), report);
        assertEquals(1, index.size());
    }

    @Test
    void shouldLoadStorageDatapointsSkippingMalformedLines() {
        UpdateReport report = service.streamingUpdate(
                new StreamingUpdateRequest("other", "gcs", null, "gs://bucket/batch"));

        assertEquals(new UpdateReport("other", 2, 1), report);
        assertEquals("one v2", index.get("1").metadata().get("title"));
    }

    @Test
    void shouldRequirePrefixForStorageSource() {
        assertThrows(IllegalArgumentException.class,
                () -> service.streamingUpdate(new StreamingUpdateRequest("idx", "gcs", null, null)));
    }

    @Test
    void shouldDeleteIdsAndRejectEmptyList() throws Exception {
        service.batchUpdate(null, null, false);

        assertEquals(new DeleteReport("idx", 1), service.streamingDelete(null, List.of("2")));
        assertNull(index.get("2"));
        assertThrows(IllegalArgumentException.class, () -> service.streamingDelete("idx", List.of()));
    }

    @Test
    void shouldBatchUpdateFromDefaultRootWithLastFileWinning() throws Exception {
        index.upsert(List.of(assembler.parse(mapper.readTree("{\"id\":\"old\",\"embedding\":[1,1]}"))));

        BatchUpdateReport report = service.batchUpdate("idx", null, true);

        assertEquals("COMPLETED", report.status());
        assertEquals(List.of("gs://bucket/batch/part-00000.json", "gs://bucket/batch/part-00001.json"), report.files());
        assertEquals(2, index.size());
        assertNull(index.get("old"));
        assertArrayEquals(new float[] { 0.5f, 0.5f }, index.get("1").denseVector());
    }

    @Test
    void shouldFailBatchUpdateWhenPrefixIsEmpty() {
        assertThrows(FileNotFoundException.class, () -> service.batchUpdate("idx", "gs://bucket/nothing-here", false));
    }

    @Test
    void shouldWrapIndexFailuresWithStage() throws Exception {
        VectorSearchService failing = new VectorSearchService() {
            @Override
            public void upsert(Collection<IndexEntry> entries) throws IOException {
                throw new IOException("index unavailable");
            }

            @Override
            public void overwrite(Collection<IndexEntry> entries) throws IOException {
                throw new IOException("index unavailable");
            }

            @Override
            public void remove(Collection<String> ids) throws IOException {
                throw new IOException("index unavailable");
            }

            @Override
            public List<List<JsonNode>> findNeighbors(List<NeighborQuery> queries) {
                return List.of();
            }
        };
        IndexUpdateService broken = service(failing);

        PipelineException upsert = assertThrows(PipelineException.class, () -> broken.batchUpdate("idx", null, false));
        PipelineException delete = assertThrows(PipelineException.class, () -> broken.streamingDelete("idx", List.of("1")));

        assertEquals(PipelineStage.UPSERT, upsert.stage());
        assertEquals(PipelineStage.DELETE, delete.stage());
        assertEquals("index unavailable", upsert.getCause().getMessage());
    }

    private IndexUpdateService service(VectorSearchService target) {
        return new IndexUpdateService(target, new DatapointLoader(new LocalBlobStore(tempDir), assembler), assembler,
                "idx", "gs://bucket/batch");
    }
}
