package com.vectorpipeline.index;

import java.util.Locale;

import com.vectorpipeline.ingest.VectorMath;

public enum DistanceMeasure {
    DOT_PRODUCT(true),
    COSINE(true),
    SQUARED_L2(false);

    private final boolean higherIsCloser;

    DistanceMeasure(boolean higherIsCloser) {
        this.higherIsCloser = higherIsCloser;
    }

    public boolean higherIsCloser() {
        return higherIsCloser;
    }

    public float score(float[] query, float[] candidate) {
        return switch (this) {
            case DOT_PRODUCT -> VectorMath.dot(query, candidate);
            case COSINE -> VectorMath.cosine(query, candidate);
            case SQUARED_L2 -> VectorMath.squaredL2(query, candidate);
        };
    }

    /**
     * Maps configured names to a measure. Unknown or blank names fall back to dot product.
     */
    public static DistanceMeasure fromName(String name) {
        if (name == null) {
            return DOT_PRODUCT;
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "COSINE", "COSINE_DISTANCE" -> COSINE;
            case "L2_NORM", "SQUARED_L2", "SQUARED_L2_DISTANCE" -> SQUARED_L2;
            default -> DOT_PRODUCT;
        };
    }
}
