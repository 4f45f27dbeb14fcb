package com.vectorpipeline.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

class RecordProjectorTest {

    private final RecordProjector projector = new RecordProjector(
            new FieldSelection(
                    List.of("title", "description"),
                    List.of("id", "title", "missing"),
                    List.of("category", "tags"),
                    List.of("price", "stock", "created_at", "active", "rating", "label"),
                    Set.of("created_at")),
            new TimestampParser());

    @Test
    void shouldJoinPresentTextFieldsWithNewlines() {
        assertEquals("A\nB", projector.buildText(row("title", "A", "description", "B")));
        assertEquals("B", projector.buildText(row("title", "", "description", "B")));
        assertEquals("", projector.buildText(row("other", "x")));
    }

    @Test
    void shouldCopyOnlyConfiguredMetadataFieldsThatArePresent() {
        Map<String, Object> metadata = projector.buildMetadata(row("id", "7", "title", null, "secret", "x"));

        assertEquals(2, metadata.size());
        assertEquals("7", metadata.get("id"));
        assertTrue(metadata.containsKey("title"));
    }

    @Test
    void shouldBuildAllowListsFromScalarsAndLists() {
        List<Restriction> restricts = projector.buildRestricts(row(
                "category", "books",
                "tags", List.of("a", "", "b")));

        assertEquals(List.of(
                Restriction.allow("category", List.of("books")),
                Restriction.allow("tags", List.of("a", "b"))), restricts);
    }

    @Test
    void shouldSkipEmptyRestrictValues() {
        assertTrue(projector.buildRestricts(row("category", "", "tags", List.of())).isEmpty());
    }

    @Test
    void shouldResolveNumericRestrictsByValueKind() {
        List<NumericRestriction> numeric = projector.buildNumericRestricts(row(
                "price", 9.5d,
                "stock", 3,
                "created_at", "2024-01-01 12:00:00",
                "active", true,
                "rating", new BigDecimal("4.25"),
                "label", "12"));

        assertEquals(List.of(
                NumericRestriction.ofFloat("price", 9.5d),
                NumericRestriction.ofInt("stock", 3L),
                NumericRestriction.ofInt("created_at", 1704110400L),
                NumericRestriction.ofInt("active", 1L),
                NumericRestriction.ofFloat("rating", 4.25d),
                NumericRestriction.ofInt("label", 12L)), numeric);
    }

    @Test
    void shouldKeepFractionOfNumericStrings() {
        assertEquals(List.of(NumericRestriction.ofFloat("price", 3.5d)),
                projector.buildNumericRestricts(row("price", "3.5")));
    }

    @Test
    void shouldSkipAndCountUnusableNumericValues() {
        Map<String, Object> record = row("price", "cheap", "created_at", "not-a-date", "stock", "2.5");

        List<NumericRestriction> numeric = projector.buildNumericRestricts(record);

        assertEquals(List.of(NumericRestriction.ofFloat("stock", 2.5d)), numeric);
        assertEquals(2, projector.countSkippedNumericFields(record));
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
