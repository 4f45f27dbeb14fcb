package com.vectorpipeline.ingest;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Tabular rows to embed. {@code where} is a row filter; null or {@code TRUE} selects every row.
 */
public interface RecordSource {
    List<Map<String, Object>> rows(String table, String where) throws IOException;
}
