package com.vectorpipeline.index;

public record UpdateReport(String indexId, int upserted, int skipped) {
}
