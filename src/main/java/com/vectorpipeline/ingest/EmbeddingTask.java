package com.vectorpipeline.ingest;

public enum EmbeddingTask {
    RETRIEVAL_DOCUMENT,
    RETRIEVAL_QUERY
}
