package com.vectorpipeline.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.vectorpipeline.index.DistanceMeasure;
import com.vectorpipeline.index.LocalJsonVectorIndex;
import com.vectorpipeline.index.NeighborQuery;
import com.vectorpipeline.index.VectorSearchService;
import com.vectorpipeline.ingest.EmbeddingService;
import com.vectorpipeline.ingest.EmbeddingTask;
import com.vectorpipeline.ingest.HashingEmbeddingService;
import com.vectorpipeline.ingest.IndexEntry;
import com.vectorpipeline.ingest.Restriction;
import com.vectorpipeline.ingest.SparseEncoder;
import com.vectorpipeline.ingest.TermBucketVector;
import com.vectorpipeline.storage.LocalBlobStore;

class SearchServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HashingEmbeddingService embeddings = new HashingEmbeddingService(256);
    private final SparseEncoder sparseEncoder = new SparseEncoder(4096);
    private LocalJsonVectorIndex index;
    private SearchService.Defaults defaults;

    @BeforeEach
    void setUp() throws IOException {
        index = new LocalJsonVectorIndex(DistanceMeasure.DOT_PRODUCT, mapper);
        List<String> texts = List.of("red running shoes", "warm wool hat");
        List<TermBucketVector> sparse = sparseEncoder.encodeCorpus(texts);
        index.upsert(List.of(
                new IndexEntry("shoe", embed(texts.get(0)), sparse.get(0),
                        List.of(Restriction.allow("category", List.of("footwear"))), List.of(), Map.of()),
                new IndexEntry("hat", embed(texts.get(1)), sparse.get(1),
                        List.of(Restriction.allow("category", List.of("headwear"))), List.of(), Map.of("title", "Wool hat"))));

        Path batch = tempDir.resolve("bucket/batch");
        Files.createDirectories(batch);
        Files.writeString(batch.resolve("part-00000.json"), """
                {"id":"hat","embedding_metadata":{"title":"stale hat"}}
                {"id":"shoe","embedding_metadata":{"title":"Red running shoes"}}
                """);
        defaults = new SearchService.Defaults(10, "endpoint", "deployed", "gs://bucket/batch");
    }

    @Test
    void shouldEmbedTextQueryAndBackfillMissingMetadata() throws Exception {
        SearchResponse response = service(embeddings).search(SearchRequest.text("red shoes", 2));

        assertEquals("text", response.queryType());
        assertEquals(2, response.numRecommendations());
        NeighborResult top = response.results().get(0);
        assertEquals("shoe", top.id());
        assertEquals(Map.of("title", "Red running shoes"), top.metadata());
        assertEquals(Map.of("title", "Wool hat"), response.results().get(1).metadata());
    }

    @Test
    void shouldSearchWithVectorAndNamespaceFilter() throws Exception {
        SearchRequest request = new SearchRequest(
                "vector",
                mapper.valueToTree(embed("red running shoes")),
                null,
                false,
                mapper.readTree("[{\"namespace\":\"category\",\"allow_list\":[\"headwear\"]}]"),
                null,
                null,
                null);

        SearchResponse response = service(embeddings).search(request);

        assertEquals(1, response.numRecommendations());
        assertEquals("hat", response.results().get(0).id());
    }

    @Test
    void shouldRankHybridTextQueries() throws Exception {
        SearchRequest request = new SearchRequest("text", TextNode.valueOf("wool"), 1, true, null, null, null, null);

        SearchResponse response = service(embeddings).search(request);

        assertEquals("hat", response.results().get(0).id());
    }

    @Test
    void shouldSkipBackfillWithoutMetadataPrefix() throws Exception {
        SearchService service = service(embeddings, new SearchService.Defaults(10, "endpoint", "deployed", null));

        SearchResponse response = service.search(SearchRequest.text("red shoes", 1));

        assertNull(response.results().get(0).metadata());
    }

    @Test
    void shouldRejectInvalidRequestsBeforeCallingCollaborators() {
        EmbeddingService mustNotBeCalled = new EmbeddingService() {
            @Override
            public float[] embed(String text, EmbeddingTask task) {
                throw new AssertionError("embedding service should not be called");
            }

            @Override
            public int dimension() {
                return 256;
            }
        };
        SearchService service = service(mustNotBeCalled);

        assertThrows(IllegalArgumentException.class, () -> service.search(new SearchRequest(
                "vector", mapper.valueToTree(new float[] { 1f }), 5, true, null, null, null, null)));
        assertThrows(IllegalArgumentException.class, () -> service.search(new SearchRequest(
                "text", mapper.valueToTree(new float[] { 1f }), 5, false, null, null, null, null)));
        assertThrows(IllegalArgumentException.class, () -> service.search(new SearchRequest(
                "vector", mapper.valueToTree(new float[] { 1f }), 5, false, null, null, null, null)));
        assertThrows(IllegalArgumentException.class, () -> service.search(SearchRequest.text("shoes", 0)));
        assertThrows(IllegalArgumentException.class, () -> service(mustNotBeCalled,
                new SearchService.Defaults(10, null, null, null)).search(SearchRequest.text("shoes", 1)));
    }

    @Test
    void shouldRejectVectorQueryOfWrongDimensionBeforeQueryingIndex() {
        VectorSearchService unreachable = new VectorSearchService() {
            @Override
            public void upsert(Collection<IndexEntry> entries) {
                throw new AssertionError("index should not be called");
            }

            @Override
            public void overwrite(Collection<IndexEntry> entries) {
                throw new AssertionError("index should not be called");
            }

            @Override
            public void remove(Collection<String> ids) {
                throw new AssertionError("index should not be called");
            }

            @Override
            public List<List<JsonNode>> findNeighbors(List<NeighborQuery> queries) {
                throw new AssertionError("index should not be called");
            }
        };
        SearchService service = new SearchService(embeddings, sparseEncoder, unreachable, new ResultMerger(mapper),
                new MetadataBackfill(new LocalBlobStore(tempDir), mapper), defaults);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> service.search(
                new SearchRequest("vector", mapper.valueToTree(new float[] { 1f, 0f, 0f }), 1, false, null, null,
                        null, null)));

        assertTrue(error.getMessage().contains("expected 256"));
    }

    @Test
    void shouldPropagateEmbeddingFailures() {
        EmbeddingService failing = new EmbeddingService() {
            @Override
            public float[] embed(String text, EmbeddingTask task) throws IOException {
                throw new IOException("embedding endpoint down");
            }

            @Override
            public int dimension() {
                return 256;
            }
        };

        IOException error = assertThrows(IOException.class, () -> service(failing).search(SearchRequest.text("x", 1)));

        assertEquals("embedding endpoint down", error.getMessage());
    }

    private SearchService service(EmbeddingService embeddingService) {
        return service(embeddingService, defaults);
    }

    private SearchService service(EmbeddingService embeddingService, SearchService.Defaults searchDefaults) {
        return new SearchService(embeddingService, sparseEncoder, index, new ResultMerger(mapper),
                new MetadataBackfill(new LocalBlobStore(tempDir), mapper), searchDefaults);
    }

    private float[] embed(String text) {
        return embeddings.embed(text, EmbeddingTask.RETRIEVAL_DOCUMENT);
    }
}
