package com.vectorpipeline.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class Tokenizer {
    private Tokenizer() {
    }

    public static List<String> tokenize(String text) {
        List<String> terms = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return terms;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        int start = -1;
        for (int i = 0; i < lowered.length(); i++) {
            if (isTermChar(lowered.charAt(i))) {
                if (start < 0) {
                    start = i;
                }
            } else if (start >= 0) {
                terms.add(lowered.substring(start, i));
                start = -1;
            }
        }
        if (start >= 0) {
            terms.add(lowered.substring(start));
        }
        return terms;
    }

    // ASCII only; non-ASCII letters act as separators
    private static boolean isTermChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
    }
}
