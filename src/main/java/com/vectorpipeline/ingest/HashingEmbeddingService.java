package com.vectorpipeline.ingest;

/**
 * Deterministic local embedding: hashed term counts plus character trigrams, L2 normalized.
 * Used when no external embedding endpoint is configured and in tests.
 */
public class HashingEmbeddingService implements EmbeddingService {
    private static final String VERSION = "local-hashing-v1";
    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0, got " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text, EmbeddingTask task) {
        float[] vector = new float[dimension];
        for (String token : Tokenizer.tokenize(text)) {
            addHashed(vector, "tok:" + token, 1.0f);
            for (int i = 0; i + 3 <= token.length(); i++) {
                addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
            }
        }
        return VectorMath.l2Normalize(vector);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return VERSION;
    }

    private void addHashed(float[] vector, String key, float weight) {
        vector[Math.floorMod(key.hashCode(), vector.length)] += weight;
    }
}
