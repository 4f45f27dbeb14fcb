package com.vectorpipeline.ingest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * BM25 term weighting hashed into a fixed number of buckets. Documents are weighted with corpus
 * statistics; queries use raw term frequency only.
 */
public class SparseEncoder {
    public static final double DEFAULT_K1 = 1.2;
    public static final double DEFAULT_B = 0.75;

    private static final Logger log = LoggerFactory.getLogger(SparseEncoder.class);

    private final int bucketCount;
    private final double k1;
    private final double b;
    private final int workerThreads;

    public SparseEncoder(int bucketCount) {
        this(bucketCount, DEFAULT_K1, DEFAULT_B, 1);
    }

    public SparseEncoder(int bucketCount, double k1, double b, int workerThreads) {
        if (bucketCount <= 0) {
            throw new IllegalArgumentException("bucketCount must be > 0, got " + bucketCount);
        }
        if (k1 < 0 || b < 0 || b > 1) {
            throw new IllegalArgumentException("BM25 parameters out of range: k1=" + k1 + " b=" + b);
        }
        this.bucketCount = bucketCount;
        this.k1 = k1;
        this.b = b;
        this.workerThreads = Math.max(1, workerThreads);
    }

    public int bucketCount() {
        return bucketCount;
    }

    public List<TermBucketVector> encodeCorpus(List<String> documents) {
        List<List<String>> tokenized = new ArrayList<>(documents.size());
        for (String document : documents) {
            tokenized.add(Tokenizer.tokenize(document));
        }
        CorpusStats stats = CorpusStats.of(tokenized);
        log.debug("Corpus stats documents={} avgLength={} distinctTerms={}",
                stats.documentCount(),
                stats.averageDocumentLength(),
                stats.documentFrequency().size());

        if (workerThreads == 1 || tokenized.size() < 2) {
            List<TermBucketVector> vectors = new ArrayList<>(tokenized.size());
            for (List<String> tokens : tokenized) {
                vectors.add(encodeDocument(tokens, stats));
            }
            return vectors;
        }
        return encodeInParallel(tokenized, stats);
    }

    public TermBucketVector encodeDocument(List<String> tokens, CorpusStats stats) {
        if (tokens.isEmpty()) {
            return TermBucketVector.EMPTY;
        }
        Map<String, Integer> tf = termFrequencies(tokens);
        double lengthRatio = tokens.size() / stats.averageDocumentLength();
        float[] buckets = new float[bucketCount];
        for (Map.Entry<String, Integer> entry : tf.entrySet()) {
            double freq = entry.getValue();
            double score = stats.idf(entry.getKey()) * (freq * (k1 + 1))
                    / (freq + k1 * (1 - b + b * lengthRatio));
            buckets[bucket(entry.getKey())] += (float) score;
        }
        return TermBucketVector.fromBuckets(buckets);
    }

    public TermBucketVector encodeQuery(String text) {
        List<String> tokens = Tokenizer.tokenize(text);
        if (tokens.isEmpty()) {
            return TermBucketVector.EMPTY;
        }
        float[] buckets = new float[bucketCount];
        for (Map.Entry<String, Integer> entry : termFrequencies(tokens).entrySet()) {
            buckets[bucket(entry.getKey())] += entry.getValue();
        }
        return TermBucketVector.fromBuckets(buckets);
    }

    public int bucket(String term) {
        return Math.floorMod(term.hashCode(), bucketCount);
    }

    private List<TermBucketVector> encodeInParallel(List<List<String>> tokenized, CorpusStats stats) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workerThreads, tokenized.size()));
        try {
            List<Future<TermBucketVector>> futures = new ArrayList<>(tokenized.size());
            for (List<String> tokens : tokenized) {
                futures.add(executor.submit(() -> encodeDocument(tokens, stats)));
            }
            List<TermBucketVector> vectors = new ArrayList<>(futures.size());
            for (Future<TermBucketVector> future : futures) {
                vectors.add(future.get());
            }
            return vectors;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Sparse scoring failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Sparse scoring interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static Map<String, Integer> termFrequencies(List<String> tokens) {
        Map<String, Integer> tf = new HashMap<>();
        for (String token : tokens) {
            tf.merge(token, 1, Integer::sum);
        }
        return tf;
    }
}
