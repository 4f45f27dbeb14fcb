package com.vectorpipeline.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds index entries and converts them to and from the JSON-lines datapoint format.
 */
public class DatapointAssembler {
    static final String ID = "id";
    static final String EMBEDDING = "embedding";
    static final String SPARSE_EMBEDDING = "sparse_embedding";
    static final String RESTRICTS = "restricts";
    static final String NUMERIC_RESTRICTS = "numeric_restricts";
    public static final String METADATA = "embedding_metadata";
    public static final String METADATA_ALIAS = "metadata";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final int expectedDimension;

    public DatapointAssembler(ObjectMapper mapper) {
        this(mapper, 0);
    }

    public DatapointAssembler(ObjectMapper mapper, int expectedDimension) {
        this.mapper = mapper;
        this.expectedDimension = expectedDimension;
    }

    public IndexEntry assemble(
            Object id,
            float[] denseVector,
            TermBucketVector sparseVector,
            List<Restriction> restricts,
            List<NumericRestriction> numericRestricts,
            Map<String, Object> metadata) {
        String entryId = id == null ? "" : String.valueOf(id);
        requireValid(entryId, denseVector);
        TermBucketVector sparse = sparseVector != null && sparseVector.hasSignal() ? sparseVector : null;
        return new IndexEntry(entryId, denseVector, sparse, restricts, numericRestricts,
                normalizeMetadata(entryId, metadata));
    }

    // stored with the value types a JSON read produces, so written entries read back equal
    private Map<String, Object> normalizeMetadata(String entryId, Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        try {
            return mapper.readValue(mapper.writeValueAsString(metadata), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata of datapoint " + entryId + " is not JSON serializable", e);
        }
    }

    private void requireValid(String entryId, float[] denseVector) {
        if (entryId.isBlank()) {
            throw new IllegalArgumentException("Datapoint id must not be empty");
        }
        if (denseVector == null || denseVector.length == 0) {
            throw new IllegalArgumentException("Datapoint " + entryId + " has an empty dense vector");
        }
        if (expectedDimension > 0 && denseVector.length != expectedDimension) {
            throw new IllegalArgumentException("Datapoint " + entryId + " has dimension " + denseVector.length
                    + ", expected " + expectedDimension);
        }
    }

    public ObjectNode toJson(IndexEntry entry) {
        ObjectNode node = mapper.createObjectNode();
        node.put(ID, entry.id());
        ArrayNode embedding = node.putArray(EMBEDDING);
        for (float value : entry.denseVector()) {
            embedding.add(value);
        }
        entry.sparse().ifPresent(sparse -> {
            ObjectNode sparseNode = node.putObject(SPARSE_EMBEDDING);
            ArrayNode values = sparseNode.putArray("values");
            ArrayNode dimensions = sparseNode.putArray("dimensions");
            for (float value : sparse.values()) {
                values.add(value);
            }
            for (int dimension : sparse.dimensions()) {
                dimensions.add(dimension);
            }
        });
        if (!entry.restricts().isEmpty()) {
            ArrayNode restricts = node.putArray(RESTRICTS);
            for (Restriction restriction : entry.restricts()) {
                ObjectNode item = restricts.addObject();
                item.put("namespace", restriction.namespace());
                restriction.allow().forEach(item.putArray("allow")::add);
                if (!restriction.deny().isEmpty()) {
                    restriction.deny().forEach(item.putArray("deny")::add);
                }
            }
        }
        if (!entry.numericRestricts().isEmpty()) {
            ArrayNode numeric = node.putArray(NUMERIC_RESTRICTS);
            for (NumericRestriction restriction : entry.numericRestricts()) {
                ObjectNode item = numeric.addObject();
                item.put("namespace", restriction.namespace());
                if (restriction.isFloat()) {
                    item.put("value_float", restriction.valueFloat());
                } else {
                    item.put("value_int", restriction.valueInt());
                }
            }
        }
        node.set(METADATA, mapper.valueToTree(entry.metadata()));
        return node;
    }

    public String toLine(IndexEntry entry) throws JsonProcessingException {
        return mapper.writeValueAsString(toJson(entry));
    }

    public IndexEntry parseLine(String line) throws IOException {
        JsonNode node = mapper.readTree(line);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Datapoint line is not a JSON object");
        }
        return parse(node);
    }

    public IndexEntry parse(JsonNode node) {
        JsonNode idNode = node.get(ID);
        if (idNode == null || idNode.isNull()) {
            throw new IllegalArgumentException("Datapoint is missing an id");
        }
        String entryId = idNode.asText();
        JsonNode embeddingNode = node.path(EMBEDDING);
        if (!embeddingNode.isArray()) {
            throw new IllegalArgumentException("Datapoint " + entryId + " has no embedding array");
        }
        float[] dense = readFloats(embeddingNode);
        requireValid(entryId, dense);

        TermBucketVector sparse = null;
        JsonNode sparseNode = node.get(SPARSE_EMBEDDING);
        if (sparseNode != null && sparseNode.isObject() && sparseNode.path("values").size() > 0) {
            float[] values = readFloats(sparseNode.path("values"));
            JsonNode dimensionsNode = sparseNode.path("dimensions");
            int[] dimensions = new int[dimensionsNode.size()];
            for (int i = 0; i < dimensions.length; i++) {
                dimensions[i] = dimensionsNode.get(i).asInt();
            }
            sparse = new TermBucketVector(dimensions, values);
        }

        List<Restriction> restricts = new ArrayList<>();
        for (JsonNode item : node.path(RESTRICTS)) {
            restricts.add(new Restriction(
                    item.path("namespace").asText(""),
                    readStrings(firstPresent(item, "allow", "allow_list")),
                    readStrings(firstPresent(item, "deny", "deny_list"))));
        }

        List<NumericRestriction> numericRestricts = new ArrayList<>();
        for (JsonNode item : node.path(NUMERIC_RESTRICTS)) {
            String namespace = item.path("namespace").asText("");
            if (item.hasNonNull("value_int")) {
                numericRestricts.add(NumericRestriction.ofInt(namespace, item.get("value_int").asLong()));
            } else if (item.hasNonNull("value_float")) {
                numericRestricts.add(NumericRestriction.ofFloat(namespace, item.get("value_float").asDouble()));
            } else if (item.hasNonNull("value_double")) {
                numericRestricts.add(NumericRestriction.ofFloat(namespace, item.get("value_double").asDouble()));
            } else {
                throw new IllegalArgumentException("Numeric restriction " + namespace + " has no value");
            }
        }

        JsonNode metadataNode = firstPresent(node, METADATA, METADATA_ALIAS);
        Map<String, Object> metadata = metadataNode.isObject() ? mapper.convertValue(metadataNode, MAP_TYPE) : Map.of();

        return new IndexEntry(entryId, dense, sparse, restricts, numericRestricts, metadata);
    }

    static JsonNode firstPresent(JsonNode node, String name, String alias) {
        JsonNode value = node.path(name);
        if (value.isMissingNode() || value.isNull() || (value.isContainerNode() && value.isEmpty())) {
            JsonNode fallback = node.path(alias);
            if (!fallback.isMissingNode() && !fallback.isNull()) {
                return fallback;
            }
        }
        return value;
    }

    private static float[] readFloats(JsonNode array) {
        float[] values = new float[array.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = (float) array.get(i).asDouble();
        }
        return values;
    }

    private static List<String> readStrings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            values.add(item.asText());
        }
        return values;
    }
}
