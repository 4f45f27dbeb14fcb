package com.vectorpipeline.ingest;

/**
 * Input of an embedding job. {@code outputPrefix} is a {@code gs://bucket/path} location;
 * a null {@code dimension} uses the configured output dimensionality.
 */
public record EmbeddingRequest(String table, String where, String outputPrefix, Integer dimension) {
}
