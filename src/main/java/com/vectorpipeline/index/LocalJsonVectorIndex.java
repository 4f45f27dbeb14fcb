package com.vectorpipeline.index;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vectorpipeline.ingest.DatapointAssembler;
import com.vectorpipeline.ingest.IndexEntry;
import com.vectorpipeline.ingest.Restriction;

/**
 * In-process {@link VectorSearchService} persisted as one JSON datapoint per line. Scores every
 * entry exactly; hybrid queries are ranked by reciprocal-rank fusion of the dense and sparse
 * rankings while each neighbor still reports its raw dense {@code distance} and
 * {@code sparse_distance}.
 */
public class LocalJsonVectorIndex implements VectorSearchService {
    static final int RRF_K = 60;

    private static final Logger log = LoggerFactory.getLogger(LocalJsonVectorIndex.class);

    private final Map<String, IndexEntry> entries = new LinkedHashMap<>();
    private final DistanceMeasure measure;
    private final DatapointAssembler assembler;
    private final ObjectMapper mapper;

    public LocalJsonVectorIndex(DistanceMeasure measure, ObjectMapper mapper) {
        this.measure = measure;
        this.mapper = mapper;
        this.assembler = new DatapointAssembler(mapper);
    }

    public static LocalJsonVectorIndex load(Path path, DistanceMeasure measure, ObjectMapper mapper) throws IOException {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(measure, mapper);
        if (!Files.exists(path)) {
            return index;
        }
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            IndexEntry entry = index.assembler.parseLine(line);
            index.entries.put(entry.id(), entry);
        }
        log.debug("Loaded {} datapoints from {}", index.entries.size(), path);
        return index;
    }

    public synchronized void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        List<String> lines = new ArrayList<>(entries.size());
        for (IndexEntry entry : entries.values()) {
            lines.add(assembler.toLine(entry));
        }
        Files.write(path, lines, StandardCharsets.UTF_8);
    }

    @Override
    public synchronized void upsert(Collection<IndexEntry> batch) {
        for (IndexEntry entry : batch) {
            entries.put(entry.id(), entry);
        }
    }

    @Override
    public synchronized void overwrite(Collection<IndexEntry> batch) {
        entries.clear();
        upsert(batch);
    }

    @Override
    public synchronized void remove(Collection<String> ids) {
        ids.forEach(entries::remove);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized IndexEntry get(String id) {
        return entries.get(id);
    }

    @Override
    public synchronized List<List<JsonNode>> findNeighbors(List<NeighborQuery> queries) {
        List<List<JsonNode>> results = new ArrayList<>(queries.size());
        for (NeighborQuery query : queries) {
            results.add(search(query));
        }
        return results;
    }

    private List<JsonNode> search(NeighborQuery query) {
        List<Scored> candidates = new ArrayList<>();
        for (IndexEntry entry : entries.values()) {
            if (!matches(entry, query.filters())) {
                continue;
            }
            float dense = measure.score(query.denseVector(), entry.denseVector());
            Float sparse = null;
            if (query.isHybrid() && entry.sparseVector() != null) {
                sparse = query.sparseVector().dot(entry.sparseVector());
            }
            candidates.add(new Scored(entry, dense, sparse));
        }

        Comparator<Scored> byDense = Comparator.comparingDouble(Scored::dense);
        candidates.sort(measure.higherIsCloser() ? byDense.reversed() : byDense);
        if (query.isHybrid()) {
            candidates = fuse(candidates);
        }

        List<JsonNode> neighbors = new ArrayList<>();
        for (Scored scored : candidates.subList(0, Math.min(query.numNeighbors(), candidates.size()))) {
            neighbors.add(query.returnFullDatapoint() ? nested(scored) : flat(scored));
        }
        return neighbors;
    }

    private List<Scored> fuse(List<Scored> denseRanked) {
        Map<String, Double> fused = new HashMap<>();
        for (int rank = 0; rank < denseRanked.size(); rank++) {
            fused.merge(denseRanked.get(rank).entry().id(), 1.0 / (RRF_K + rank + 1), Double::sum);
        }
        List<Scored> sparseRanked = denseRanked.stream()
                .filter(scored -> scored.sparse() != null && scored.sparse() > 0f)
                .sorted(Comparator.comparingDouble((Scored scored) -> scored.sparse()).reversed())
                .toList();
        for (int rank = 0; rank < sparseRanked.size(); rank++) {
            fused.merge(sparseRanked.get(rank).entry().id(), 1.0 / (RRF_K + rank + 1), Double::sum);
        }
        List<Scored> ordered = new ArrayList<>(denseRanked);
        ordered.sort(Comparator.comparingDouble((Scored scored) -> fused.get(scored.entry().id())).reversed());
        return ordered;
    }

    private static boolean matches(IndexEntry entry, List<NamespaceFilter> filters) {
        for (NamespaceFilter filter : filters) {
            List<String> tokens = new ArrayList<>();
            for (Restriction restriction : entry.restricts()) {
                if (restriction.namespace().equals(filter.namespace())) {
                    tokens.addAll(restriction.allow());
                }
            }
            if (!filter.allow().isEmpty() && tokens.stream().noneMatch(filter.allow()::contains)) {
                return false;
            }
            if (tokens.stream().anyMatch(filter.deny()::contains)) {
                return false;
            }
        }
        return true;
    }

    private JsonNode nested(Scored scored) {
        ObjectNode neighbor = mapper.createObjectNode();
        ObjectNode datapoint = neighbor.putObject("datapoint");
        datapoint.put("datapoint_id", scored.entry().id());
        if (!scored.entry().metadata().isEmpty()) {
            datapoint.set(DatapointAssembler.METADATA, mapper.valueToTree(scored.entry().metadata()));
        }
        putScores(neighbor, scored);
        return neighbor;
    }

    private JsonNode flat(Scored scored) {
        ObjectNode neighbor = mapper.createObjectNode();
        neighbor.put("id", scored.entry().id());
        putScores(neighbor, scored);
        return neighbor;
    }

    private static void putScores(ObjectNode neighbor, Scored scored) {
        neighbor.put("distance", scored.dense());
        if (scored.sparse() != null) {
            neighbor.put("sparse_distance", scored.sparse());
        }
    }

    private record Scored(IndexEntry entry, float dense, Float sparse) {
    }
}
