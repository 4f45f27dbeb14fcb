package com.vectorpipeline.ingest;

import java.util.List;

public record Restriction(String namespace, List<String> allow, List<String> deny) {
    public Restriction {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("Restriction namespace must not be blank");
        }
        allow = allow == null ? List.of() : List.copyOf(allow);
        deny = deny == null ? List.of() : List.copyOf(deny);
    }

    public static Restriction allow(String namespace, List<String> tokens) {
        return new Restriction(namespace, tokens, List.of());
    }
}
