package com.vectorpipeline.ingest;

public final class VectorMath {
    private VectorMath() {
    }

    /**
     * Returns a unit-length copy. Zero vectors are returned unchanged.
     */
    public static float[] l2Normalize(float[] vector) {
        float[] out = vector.clone();
        double norm = 0.0;
        for (float value : out) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm == 0.0) {
            return out;
        }
        for (int i = 0; i < out.length; i++) {
            out[i] = (float) (out[i] / norm);
        }
        return out;
    }

    public static float dot(float[] a, float[] b) {
        int len = requireSameLength(a, b);
        float dot = 0f;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
        }
        return dot;
    }

    public static float cosine(float[] a, float[] b) {
        int len = requireSameLength(a, b);
        float dot = 0f;
        float aNorm = 0f;
        float bNorm = 0f;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0f || bNorm == 0f) {
            return 0f;
        }
        return (float) (dot / Math.sqrt(aNorm * bNorm));
    }

    public static float squaredL2(float[] a, float[] b) {
        int len = requireSameLength(a, b);
        float sum = 0f;
        for (int i = 0; i < len; i++) {
            float diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    private static int requireSameLength(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        return a.length;
    }
}
