package com.vectorpipeline.ingest;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Unit persisted to and upserted into the vector-search service. A {@code null} sparse vector
 * means the entry carries no lexical signal at all.
 */
public record IndexEntry(
        String id,
        float[] denseVector,
        TermBucketVector sparseVector,
        List<Restriction> restricts,
        List<NumericRestriction> numericRestricts,
        Map<String, Object> metadata) {

    public IndexEntry {
        restricts = restricts == null ? List.of() : List.copyOf(restricts);
        numericRestricts = numericRestricts == null ? List.of() : List.copyOf(numericRestricts);
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        denseVector = denseVector == null ? new float[0] : denseVector.clone();
    }

    public Optional<TermBucketVector> sparse() {
        return Optional.ofNullable(sparseVector);
    }

    @Override
    public float[] denseVector() {
        return denseVector.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexEntry other)) {
            return false;
        }
        return Objects.equals(id, other.id)
                && Arrays.equals(denseVector, other.denseVector)
                && Objects.equals(sparseVector, other.sparseVector)
                && restricts.equals(other.restricts)
                && numericRestricts.equals(other.numericRestricts)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, Arrays.hashCode(denseVector), sparseVector, restricts, numericRestricts, metadata);
    }

    @Override
    public String toString() {
        return "IndexEntry[id=" + id
                + ", dimension=" + denseVector.length
                + ", sparse=" + sparseVector
                + ", restricts=" + restricts
                + ", numericRestricts=" + numericRestricts
                + ", metadata=" + metadata + "]";
    }
}
