package com.vectorpipeline.ingest;

import java.util.List;
import java.util.Set;

public record FieldSelection(
        List<String> textFields,
        List<String> metadataFields,
        List<String> restrictFields,
        List<String> numericRestrictFields,
        Set<String> timestampFields) {

    public static final Set<String> DEFAULT_TIMESTAMP_FIELDS = Set.of("created_at", "updated_at");

    public FieldSelection {
        textFields = textFields == null ? List.of() : List.copyOf(textFields);
        metadataFields = metadataFields == null ? List.of() : List.copyOf(metadataFields);
        restrictFields = restrictFields == null ? List.of() : List.copyOf(restrictFields);
        numericRestrictFields = numericRestrictFields == null ? List.of() : List.copyOf(numericRestrictFields);
        timestampFields = timestampFields == null ? DEFAULT_TIMESTAMP_FIELDS : Set.copyOf(timestampFields);
    }
}
