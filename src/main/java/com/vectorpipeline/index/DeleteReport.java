package com.vectorpipeline.index;

public record DeleteReport(String indexId, int deleted) {
}
