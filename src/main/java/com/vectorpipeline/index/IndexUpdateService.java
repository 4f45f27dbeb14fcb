package com.vectorpipeline.index;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.vectorpipeline.ingest.DatapointAssembler;
import com.vectorpipeline.ingest.IndexEntry;
import com.vectorpipeline.runtime.PipelineException;
import com.vectorpipeline.runtime.PipelineStage;
import com.vectorpipeline.storage.BlobLocation;

public class IndexUpdateService {
    private static final Logger log = LoggerFactory.getLogger(IndexUpdateService.class);

    private final VectorSearchService index;
    private final DatapointLoader loader;
    private final DatapointAssembler assembler;
    private final String defaultIndexId;
    private final String defaultBatchRoot;

    public IndexUpdateService(VectorSearchService index,
            DatapointLoader loader,
            DatapointAssembler assembler,
            String defaultIndexId,
            String defaultBatchRoot) {
        this.index = index;
        this.loader = loader;
        this.assembler = assembler;
        this.defaultIndexId = defaultIndexId;
        this.defaultBatchRoot = defaultBatchRoot;
    }

    public UpdateReport streamingUpdate(StreamingUpdateRequest request) {
        String indexId = resolveIndexId(request.indexId(), "streaming update");
        List<IndexEntry> entries;
        int skipped = 0;
        if (request.fromStorage()) {
            if (isBlank(request.datapointsPrefix())) {
                throw new IllegalArgumentException("datapointsPrefix is required when source is gcs");
            }
            BlobLocation prefix = BlobLocation.parse(request.datapointsPrefix());
            DatapointLoader.Loaded loaded = load(prefix);
            entries = lastWriteWins(loaded.entries());
            skipped = loaded.skipped();
        } else {
            if (request.datapoints().isEmpty()) {
                throw new IllegalArgumentException("datapoints must not be empty when source is api");
            }
            entries = new ArrayList<>(request.datapoints().size());
            for (JsonNode datapoint : request.datapoints()) {
                entries.add(assembler.parse(datapoint));
            }
            requireUniqueIds(entries);
        }

        try {
            index.upsert(entries);
        } catch (IOException | RuntimeException e) {
            throw new PipelineException(PipelineStage.UPSERT, e);
        }
        log.info("Upserted {} datapoints into {} (skipped={})", entries.size(), indexId, skipped);
        return new UpdateReport(indexId, entries.size(), skipped);
    }

    public DeleteReport streamingDelete(String requestedIndexId, List<String> datapointIds) {
        String indexId = resolveIndexId(requestedIndexId, "streaming delete");
        List<String> ids = datapointIds == null ? List.of() : datapointIds.stream().map(String::valueOf).toList();
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("datapointIds must not be empty");
        }
        try {
            index.remove(ids);
        } catch (IOException | RuntimeException e) {
            throw new PipelineException(PipelineStage.DELETE, e);
        }
        log.info("Removed {} datapoints from {}", ids.size(), indexId);
        return new DeleteReport(indexId, ids.size());
    }

    public BatchUpdateReport batchUpdate(String requestedIndexId, String contentsDeltaUri, boolean completeOverwrite)
            throws FileNotFoundException {
        String indexId = resolveIndexId(requestedIndexId, "batch update");
        String uri = isBlank(contentsDeltaUri) ? defaultBatchRoot : contentsDeltaUri;
        if (isBlank(uri)) {
            throw new IllegalArgumentException("contentsDeltaUri is required for batch update");
        }
        DatapointLoader.Loaded loaded = load(BlobLocation.parse(uri));
        if (loaded.files().isEmpty()) {
            throw new FileNotFoundException("No files found in " + uri);
        }
        List<String> files = loaded.files().stream().map(BlobLocation::uri).toList();
        log.info("Batch update of {} using files {}", indexId, files);
        List<IndexEntry> entries = lastWriteWins(loaded.entries());

        try {
            if (completeOverwrite) {
                index.overwrite(entries);
            } else {
                index.upsert(entries);
            }
        } catch (IOException | RuntimeException e) {
            throw new PipelineException(PipelineStage.UPSERT, e);
        }
        return new BatchUpdateReport("COMPLETED", indexId, files, uri, entries.size(), loaded.skipped());
    }

    private DatapointLoader.Loaded load(BlobLocation prefix) {
        try {
            return loader.load(prefix);
        } catch (IOException e) {
            throw new PipelineException(PipelineStage.LOAD_DATAPOINTS, e);
        }
    }

    private String resolveIndexId(String requested, String operation) {
        String indexId = isBlank(requested) ? defaultIndexId : requested;
        if (isBlank(indexId)) {
            throw new IllegalArgumentException("indexId is required for " + operation);
        }
        return indexId;
    }

    private static void requireUniqueIds(List<IndexEntry> entries) {
        Set<String> seen = new LinkedHashSet<>();
        for (IndexEntry entry : entries) {
            if (!seen.add(entry.id())) {
                throw new IllegalArgumentException("Duplicate datapoint id in batch: " + entry.id());
            }
        }
    }

    // files listed later supersede earlier ones for the same id
    private static List<IndexEntry> lastWriteWins(List<IndexEntry> entries) {
        Map<String, IndexEntry> byId = new LinkedHashMap<>();
        for (IndexEntry entry : entries) {
            byId.remove(entry.id());
            byId.put(entry.id(), entry);
        }
        return new ArrayList<>(byId.values());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
