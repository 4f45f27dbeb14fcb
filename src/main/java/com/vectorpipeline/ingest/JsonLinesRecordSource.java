package com.vectorpipeline.ingest;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads {@code <table>.jsonl} from a directory, one JSON object per row. Supports
 * {@code TRUE} and {@code field = 'value'} filters.
 */
public class JsonLinesRecordSource implements RecordSource {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesRecordSource.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final Pattern EQUALS = Pattern.compile("\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*'((?:[^']|'')*)'\\s*");
    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonLinesRecordSource(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    @Override
    public List<Map<String, Object>> rows(String table, String where) throws IOException {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        RowFilter filter = RowFilter.parse(where);
        Path file = directory.resolve(table + ".jsonl");
        if (!Files.exists(file)) {
            throw new FileNotFoundException("Table " + table + " not found at " + file);
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                Map<String, Object> row = mapper.readValue(line, ROW_TYPE);
                if (filter.matches(row)) {
                    rows.add(row);
                }
            }
        }
        log.info("Read {} rows from {} where {}", rows.size(), file, where == null ? "TRUE" : where);
        return rows;
    }

    record RowFilter(String field, String value) {
        static final RowFilter ALL = new RowFilter(null, null);

        static RowFilter parse(String where) {
            if (where == null || where.isBlank() || where.trim().equalsIgnoreCase("TRUE")) {
                return ALL;
            }
            Matcher matcher = EQUALS.matcher(where);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Unsupported where clause: " + where);
            }
            return new RowFilter(matcher.group(1), matcher.group(2).replace("''", "'"));
        }

        boolean matches(Map<String, Object> row) {
            if (field == null) {
                return true;
            }
            Object actual = row.get(field);
            return actual != null && Objects.equals(String.valueOf(actual), value);
        }
    }
}
