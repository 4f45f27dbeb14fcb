package com.vectorpipeline.index;

import java.util.List;

public record BatchUpdateReport(String status, String indexId, List<String> files, String contentsDeltaUri, int loaded, int skipped) {
}
