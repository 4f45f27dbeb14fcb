package com.vectorpipeline.search;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vectorpipeline.index.NamespaceFilter;
import com.vectorpipeline.index.NeighborQuery;
import com.vectorpipeline.index.VectorSearchService;
import com.vectorpipeline.ingest.EmbeddingService;
import com.vectorpipeline.ingest.EmbeddingTask;
import com.vectorpipeline.ingest.SparseEncoder;
import com.vectorpipeline.ingest.TermBucketVector;
import com.vectorpipeline.ingest.VectorMath;
import com.vectorpipeline.storage.BlobLocation;

/**
 * Encodes a query, asks the vector-search service for neighbors and returns them with metadata
 * filled in from the datapoint files when the index did not return it. Collaborator failures
 * propagate to the caller.
 */
public class SearchService {
    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final EmbeddingService embeddingService;
    private final SparseEncoder sparseEncoder;
    private final VectorSearchService index;
    private final ResultMerger merger;
    private final MetadataBackfill backfill;
    private final Defaults defaults;

    public SearchService(EmbeddingService embeddingService,
            SparseEncoder sparseEncoder,
            VectorSearchService index,
            ResultMerger merger,
            MetadataBackfill backfill,
            Defaults defaults) {
        this.embeddingService = embeddingService;
        this.sparseEncoder = sparseEncoder;
        this.index = index;
        this.merger = merger;
        this.backfill = backfill;
        this.defaults = defaults;
    }

    public SearchResponse search(SearchRequest request) throws IOException {
        QueryType type = QueryType.fromName(request.queryType());
        QueryInput input = QueryInput.of(type, request.query());
        if (request.hybrid() && !input.isText()) {
            throw new IllegalArgumentException("hybrid search requires a text query");
        }
        int topK = request.topK() == null ? defaults.topK() : request.topK();
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be > 0, got " + topK);
        }
        if (!input.isText() && input.vector().length != embeddingService.dimension()) {
            throw new IllegalArgumentException("Query vector has dimension " + input.vector().length
                    + ", expected " + embeddingService.dimension());
        }
        requireTarget(request);
        List<NamespaceFilter> filters = NamespaceFilter.fromJson(request.restricts());

        long started = System.nanoTime();
        float[] dense;
        if (input.isText()) {
            dense = VectorMath.l2Normalize(embeddingService.embed(input.text(), EmbeddingTask.RETRIEVAL_QUERY));
        } else {
            dense = input.vector();
        }
        TermBucketVector sparse = request.hybrid() ? sparseEncoder.encodeQuery(input.text()) : null;
        log.debug("search.encode runtimeMs={}", elapsedMs(started));

        started = System.nanoTime();
        NeighborQuery query = new NeighborQuery(dense, sparse, topK, filters, true);
        List<NeighborResult> results = merger.normalize(index.findNeighbors(List.of(query)).get(0));
        log.debug("search.query runtimeMs={} neighbors={}", elapsedMs(started), results.size());

        Set<String> missing = merger.missingMetadataIds(results);
        String prefix = isBlank(request.metadataPrefix()) ? defaults.metadataPrefix() : request.metadataPrefix();
        if (!missing.isEmpty() && !isBlank(prefix)) {
            started = System.nanoTime();
            BackfillResult found = backfill.lookup(BlobLocation.parse(prefix), missing);
            results = merger.applyBackfill(results, found.found());
            log.debug("search.backfill runtimeMs={} requested={} found={} skippedLines={}",
                    elapsedMs(started), missing.size(), found.found().size(), found.skippedLines());
        }

        return new SearchResponse(request.query(), type.wireName(), results.size(), results);
    }

    private void requireTarget(SearchRequest request) {
        String endpointId = isBlank(request.endpointId()) ? defaults.endpointId() : request.endpointId();
        String deployedIndexId = isBlank(request.deployedIndexId()) ? defaults.deployedIndexId() : request.deployedIndexId();
        if (isBlank(endpointId) || isBlank(deployedIndexId)) {
            throw new IllegalArgumentException("endpointId and deployedIndexId are required for search");
        }
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record Defaults(int topK, String endpointId, String deployedIndexId, String metadataPrefix) {
    }
}
