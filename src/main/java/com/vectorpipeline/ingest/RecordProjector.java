package com.vectorpipeline.ingest;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts embedding text, display metadata and filter clauses from a raw record. Only the
 * configured fields are ever read.
 */
public class RecordProjector {
    private static final Logger log = LoggerFactory.getLogger(RecordProjector.class);

    private final FieldSelection fields;
    private final TimestampParser timestampParser;

    public RecordProjector(FieldSelection fields, TimestampParser timestampParser) {
        this.fields = fields;
        this.timestampParser = timestampParser;
    }

    public String buildText(Map<String, Object> record) {
        List<String> parts = new ArrayList<>();
        for (String field : fields.textFields()) {
            Object value = record.get(field);
            if (isEmpty(value)) {
                continue;
            }
            parts.add(String.valueOf(value));
        }
        return String.join("\n", parts);
    }

    public Map<String, Object> buildMetadata(Map<String, Object> record) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (String field : fields.metadataFields()) {
            if (record.containsKey(field)) {
                metadata.put(field, record.get(field));
            }
        }
        return metadata;
    }

    public List<Restriction> buildRestricts(Map<String, Object> record) {
        List<Restriction> restricts = new ArrayList<>();
        for (String field : fields.restrictFields()) {
            Object value = record.get(field);
            if (isEmpty(value)) {
                continue;
            }
            List<String> allow = new ArrayList<>();
            Collection<?> elements = asCollection(value);
            if (elements != null) {
                for (Object element : elements) {
                    if (!isEmpty(element)) {
                        allow.add(String.valueOf(element));
                    }
                }
            } else {
                allow.add(String.valueOf(value));
            }
            if (!allow.isEmpty()) {
                restricts.add(Restriction.allow(field, allow));
            }
        }
        return restricts;
    }

    public List<NumericRestriction> buildNumericRestricts(Map<String, Object> record) {
        List<NumericRestriction> restricts = new ArrayList<>();
        for (String field : fields.numericRestrictFields()) {
            resolveNumeric(field, record.get(field)).ifPresent(restricts::add);
        }
        return restricts;
    }

    /**
     * Counts configured numeric fields that carry a value but could not be turned into a
     * restriction.
     */
    public int countSkippedNumericFields(Map<String, Object> record) {
        int skipped = 0;
        for (String field : fields.numericRestrictFields()) {
            Object raw = record.get(field);
            if (!isEmpty(raw) && resolveNumeric(field, raw).isEmpty()) {
                skipped++;
            }
        }
        return skipped;
    }

    private Optional<NumericRestriction> resolveNumeric(String field, Object raw) {
        if (isEmpty(raw)) {
            return Optional.empty();
        }
        if (fields.timestampFields().contains(field)) {
            OptionalLong epochSeconds = timestampParser.parse(raw);
            if (epochSeconds.isEmpty()) {
                log.debug("Skipping unparseable timestamp field={} value={}", field, raw);
                return Optional.empty();
            }
            return Optional.of(NumericRestriction.ofInt(field, epochSeconds.getAsLong()));
        }
        if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal) {
            return Optional.of(NumericRestriction.ofFloat(field, ((Number) raw).doubleValue()));
        }
        if (raw instanceof Number number) {
            return Optional.of(NumericRestriction.ofInt(field, number.longValue()));
        }
        if (raw instanceof Boolean flag) {
            return Optional.of(NumericRestriction.ofInt(field, flag ? 1L : 0L));
        }
        // numeric strings keep their fractional part: "3.5" is a float restriction, "12" an int one
        String text = raw.toString().trim();
        try {
            return Optional.of(NumericRestriction.ofInt(field, Long.parseLong(text)));
        } catch (NumberFormatException notIntegral) {
            try {
                return Optional.of(NumericRestriction.ofFloat(field, Double.parseDouble(text)));
            } catch (NumberFormatException e) {
                log.debug("Skipping non-numeric field={} value={}", field, raw);
                return Optional.empty();
            }
        }
    }

    private static Collection<?> asCollection(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection;
        }
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return null;
    }

    static boolean isEmpty(Object value) {
        return value == null || (value instanceof CharSequence text && text.length() == 0);
    }
}
