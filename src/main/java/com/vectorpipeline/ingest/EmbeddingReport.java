package com.vectorpipeline.ingest;

public record EmbeddingReport(String status, String outputPrefix, String outputFile, int rowCount, int skippedFields) {
    public static final String EMBEDDED = "EMBEDDED";
}
