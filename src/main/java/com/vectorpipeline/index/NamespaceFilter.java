package com.vectorpipeline.index;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

public record NamespaceFilter(String namespace, List<String> allow, List<String> deny) {
    public NamespaceFilter {
        allow = allow == null ? List.of() : List.copyOf(allow);
        deny = deny == null ? List.of() : List.copyOf(deny);
    }

    /**
     * Reads filter items of the form {@code {namespace|name, allow|allow_list|allow_tokens,
     * deny|deny_list|deny_tokens}}. Items without a namespace are ignored.
     */
    public static List<NamespaceFilter> fromJson(JsonNode items) {
        List<NamespaceFilter> filters = new ArrayList<>();
        if (items == null || !items.isArray()) {
            return filters;
        }
        for (JsonNode item : items) {
            String namespace = item.path("namespace").asText("");
            if (namespace.isEmpty()) {
                namespace = item.path("name").asText("");
            }
            if (namespace.isEmpty()) {
                continue;
            }
            filters.add(new NamespaceFilter(
                    namespace,
                    tokens(item, "allow", "allow_list", "allow_tokens"),
                    tokens(item, "deny", "deny_list", "deny_tokens")));
        }
        return filters;
    }

    private static List<String> tokens(JsonNode item, String... names) {
        for (String name : names) {
            JsonNode array = item.path(name);
            if (array.isArray() && !array.isEmpty()) {
                List<String> tokens = new ArrayList<>();
                array.forEach(token -> tokens.add(token.asText()));
                return tokens;
            }
        }
        return List.of();
    }
}
