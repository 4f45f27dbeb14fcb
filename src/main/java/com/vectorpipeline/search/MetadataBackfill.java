package com.vectorpipeline.search;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vectorpipeline.storage.BlobLocation;
import com.vectorpipeline.storage.BlobStore;

/**
 * Looks up metadata for neighbors that came back without it by scanning the JSON-lines
 * datapoint files under a storage prefix. The scan stops as soon as every requested id has been
 * seen; the first non-empty metadata found for an id wins.
 */
public class MetadataBackfill {
    private static final Logger log = LoggerFactory.getLogger(MetadataBackfill.class);

    private final BlobStore blobStore;
    private final ObjectMapper mapper;
    private final int scanThreads;

    public MetadataBackfill(BlobStore blobStore, ObjectMapper mapper) {
        this(blobStore, mapper, 1);
    }

    public MetadataBackfill(BlobStore blobStore, ObjectMapper mapper, int scanThreads) {
        this.blobStore = blobStore;
        this.mapper = mapper;
        this.scanThreads = Math.max(1, scanThreads);
    }

    public BackfillResult lookup(BlobLocation prefix, Set<String> ids) throws IOException {
        if (ids.isEmpty()) {
            return BackfillResult.NONE;
        }
        List<BlobLocation> files = blobStore.list(prefix);
        if (scanThreads == 1 || files.size() < 2) {
            return scanSequentially(files, ids);
        }
        return scanInParallel(files, ids);
    }

    private BackfillResult scanSequentially(List<BlobLocation> files, Set<String> ids) throws IOException {
        Map<String, Map<String, Object>> found = new LinkedHashMap<>();
        AtomicInteger skipped = new AtomicInteger();
        int scanned = 0;
        for (BlobLocation file : files) {
            if (found.size() == ids.size()) {
                break;
            }
            scanned++;
            scanFile(file, ids, found, skipped);
        }
        log.debug("Metadata backfill found {}/{} ids in {} files (skipped {} lines)",
                found.size(), ids.size(), scanned, skipped.get());
        return new BackfillResult(found, skipped.get(), scanned);
    }

    private BackfillResult scanInParallel(List<BlobLocation> files, Set<String> ids) throws IOException {
        Map<String, Map<String, Object>> found = new ConcurrentHashMap<>();
        AtomicInteger skipped = new AtomicInteger();
        AtomicInteger scanned = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(scanThreads, files.size()));
        CompletionService<Void> completion = new ExecutorCompletionService<>(executor);
        List<Future<Void>> shards = new ArrayList<>(files.size());
        try {
            for (BlobLocation file : files) {
                shards.add(completion.submit(() -> {
                    if (found.size() < ids.size() && !Thread.currentThread().isInterrupted()) {
                        scanned.incrementAndGet();
                        scanFile(file, ids, found, skipped);
                    }
                    return null;
                }));
            }
            for (int done = 0; done < shards.size(); done++) {
                completion.take().get();
                if (found.size() == ids.size()) {
                    shards.forEach(shard -> shard.cancel(true));
                    break;
                }
            }
        } catch (ExecutionException e) {
            shards.forEach(shard -> shard.cancel(true));
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new IllegalStateException("Metadata scan failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Metadata scan interrupted", e);
        } finally {
            executor.shutdownNow();
        }
        log.debug("Parallel metadata backfill found {}/{} ids in {} files (skipped {} lines)",
                found.size(), ids.size(), scanned.get(), skipped.get());
        return new BackfillResult(new LinkedHashMap<>(found), skipped.get(), scanned.get());
    }

    private void scanFile(BlobLocation file,
            Set<String> ids,
            Map<String, Map<String, Object>> found,
            AtomicInteger skipped) throws IOException {
        for (String line : blobStore.readText(file).split("\\R")) {
            if (found.size() == ids.size() || Thread.currentThread().isInterrupted()) {
                return;
            }
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            JsonNode record;
            try {
                record = mapper.readTree(trimmed);
            } catch (JsonProcessingException e) {
                skipped.incrementAndGet();
                log.debug("Skipping malformed line in {}: {}", file, e.getOriginalMessage());
                continue;
            }
            if (record == null || !record.isObject()) {
                skipped.incrementAndGet();
                continue;
            }
            String id = record.path("id").asText("");
            if (!ids.contains(id) || found.containsKey(id)) {
                continue;
            }
            Map<String, Object> metadata = metadataOf(record);
            if (metadata != null) {
                found.putIfAbsent(id, metadata);
            }
        }
    }

    private Map<String, Object> metadataOf(JsonNode record) {
        for (String field : new String[] { "embedding_metadata", "metadata" }) {
            JsonNode value = record.get(field);
            if (value != null && value.isObject() && !value.isEmpty()) {
                return mapper.convertValue(value, RawNeighbor.MAP_TYPE);
            }
        }
        return null;
    }
}
