package com.vectorpipeline.search;

import java.util.Map;

public record BackfillResult(Map<String, Map<String, Object>> found, int skippedLines, int scannedFiles) {
    public static final BackfillResult NONE = new BackfillResult(Map.of(), 0, 0);

    public BackfillResult {
        found = Map.copyOf(found);
    }
}
