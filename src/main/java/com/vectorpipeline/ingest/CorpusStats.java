package com.vectorpipeline.ingest;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Batch-wide statistics for BM25 scoring. Must be computed over the whole batch before any
 * document is scored.
 */
public record CorpusStats(int documentCount, double averageDocumentLength, Map<String, Integer> documentFrequency) {

    public CorpusStats {
        documentFrequency = Map.copyOf(documentFrequency);
    }

    public static CorpusStats of(List<List<String>> tokenizedDocuments) {
        Map<String, Integer> df = new HashMap<>();
        long totalLength = 0;
        for (List<String> tokens : tokenizedDocuments) {
            totalLength += tokens.size();
            Set<String> seen = new HashSet<>(tokens);
            for (String term : seen) {
                df.merge(term, 1, Integer::sum);
            }
        }
        int count = tokenizedDocuments.size();
        double average = count == 0 ? 1.0 : (double) totalLength / count;
        if (average == 0.0) {
            average = 1.0;
        }
        return new CorpusStats(count, average, df);
    }

    public int documentFrequency(String term) {
        return documentFrequency.getOrDefault(term, 0);
    }

    public double idf(String term) {
        int df = documentFrequency(term);
        return Math.log((documentCount - df + 0.5) / (df + 0.5) + 1.0);
    }
}
