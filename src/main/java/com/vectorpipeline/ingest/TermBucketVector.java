package com.vectorpipeline.ingest;

import java.util.Arrays;

/**
 * Sparse lexical vector over a hashed bucket space, stored as parallel index and weight arrays.
 */
public record TermBucketVector(int[] dimensions, float[] values) {
    public static final TermBucketVector EMPTY = new TermBucketVector(new int[0], new float[0]);

    public TermBucketVector {
        if (dimensions == null || values == null) {
            throw new IllegalArgumentException("dimensions and values must not be null");
        }
        if (dimensions.length != values.length) {
            throw new IllegalArgumentException("dimensions and values must have equal length, got "
                    + dimensions.length + " and " + values.length);
        }
        dimensions = dimensions.clone();
        values = values.clone();
    }

    @Override
    public int[] dimensions() {
        return dimensions.clone();
    }

    @Override
    public float[] values() {
        return values.clone();
    }

    public int size() {
        return dimensions.length;
    }

    public boolean hasSignal() {
        for (float value : values) {
            if (value != 0f) {
                return true;
            }
        }
        return false;
    }

    public float dot(TermBucketVector other) {
        float sum = 0f;
        for (int i = 0; i < dimensions.length; i++) {
            for (int j = 0; j < other.dimensions.length; j++) {
                if (dimensions[i] == other.dimensions[j]) {
                    sum += values[i] * other.values[j];
                }
            }
        }
        return sum;
    }

    static TermBucketVector fromBuckets(float[] buckets) {
        int nonZero = 0;
        for (float bucket : buckets) {
            if (bucket != 0f) {
                nonZero++;
            }
        }
        int[] dimensions = new int[nonZero];
        float[] values = new float[nonZero];
        int cursor = 0;
        for (int i = 0; i < buckets.length; i++) {
            if (buckets[i] != 0f) {
                dimensions[cursor] = i;
                values[cursor] = buckets[i];
                cursor++;
            }
        }
        return new TermBucketVector(dimensions, values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TermBucketVector other)) {
            return false;
        }
        return Arrays.equals(dimensions, other.dimensions) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(dimensions) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "TermBucketVector[dimensions=" + Arrays.toString(dimensions)
                + ", values=" + Arrays.toString(values) + "]";
    }
}
