package com.vectorpipeline.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.vectorpipeline.runtime.PipelineException;
import com.vectorpipeline.runtime.PipelineStage;
import com.vectorpipeline.storage.BlobLocation;
import com.vectorpipeline.storage.BlobStore;

/**
 * Turns the rows of a table into a JSON-lines datapoint file ready for a batch index update.
 * Any collaborator failure aborts the whole job and no file is written.
 */
public class EmbeddingJob {
    static final String OUTPUT_FILE = "part-00000.json";

    private static final Logger log = LoggerFactory.getLogger(EmbeddingJob.class);

    private final RecordSource recordSource;
    private final EmbeddingService embeddingService;
    private final SparseEncoder sparseEncoder;
    private final RecordProjector projector;
    private final DatapointAssembler assembler;
    private final BlobStore blobStore;
    private final String defaultOutputPrefix;

    /**
     * @param sparseEncoder null disables sparse vectors
     */
    public EmbeddingJob(RecordSource recordSource,
            EmbeddingService embeddingService,
            SparseEncoder sparseEncoder,
            RecordProjector projector,
            DatapointAssembler assembler,
            BlobStore blobStore,
            String defaultOutputPrefix) {
        this.recordSource = recordSource;
        this.embeddingService = embeddingService;
        this.sparseEncoder = sparseEncoder;
        this.projector = projector;
        this.assembler = assembler;
        this.blobStore = blobStore;
        this.defaultOutputPrefix = defaultOutputPrefix;
    }

    public EmbeddingReport run(EmbeddingRequest request) {
        if (request.table() == null || request.table().isBlank()) {
            throw new IllegalArgumentException("table is required");
        }
        String prefix = isBlank(request.outputPrefix()) ? defaultOutputPrefix : request.outputPrefix();
        if (isBlank(prefix)) {
            throw new IllegalArgumentException("outputPrefix is required when no batch root is configured");
        }
        BlobLocation output = BlobLocation.parse(prefix).child(OUTPUT_FILE);
        if (request.dimension() != null && request.dimension() != embeddingService.dimension()) {
            throw new IllegalArgumentException("Requested dimension " + request.dimension()
                    + " does not match embedding service dimension " + embeddingService.dimension());
        }

        List<Map<String, Object>> rows;
        try {
            rows = recordSource.rows(request.table(), request.where());
        } catch (IOException e) {
            throw new PipelineException(PipelineStage.READ_SOURCE, e);
        }

        List<String> texts = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            texts.add(nonEmpty(projector.buildText(row)));
        }

        List<float[]> vectors;
        try {
            vectors = embeddingService.embedAll(texts, EmbeddingTask.RETRIEVAL_DOCUMENT);
        } catch (IOException | RuntimeException e) {
            throw new PipelineException(PipelineStage.EMBED, e);
        }
        if (vectors.size() != rows.size()) {
            throw new PipelineException(PipelineStage.EMBED, new IllegalStateException(
                    "Embedding service returned " + vectors.size() + " vectors for " + rows.size() + " rows"));
        }

        List<TermBucketVector> sparse = null;
        if (sparseEncoder != null) {
            try {
                sparse = sparseEncoder.encodeCorpus(texts);
            } catch (RuntimeException e) {
                throw new PipelineException(PipelineStage.ENCODE_SPARSE, e);
            }
        }

        Map<String, IndexEntry> entries = new LinkedHashMap<>();
        int skippedFields = 0;
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            IndexEntry entry = assembler.assemble(
                    row.get("id"),
                    VectorMath.l2Normalize(vectors.get(i)),
                    sparse == null ? null : sparse.get(i),
                    projector.buildRestricts(row),
                    projector.buildNumericRestricts(row),
                    projector.buildMetadata(row));
            skippedFields += projector.countSkippedNumericFields(row);
            // a later row with the same id replaces the earlier one
            if (entries.remove(entry.id()) != null) {
                log.warn("Duplicate row id {} in {}, keeping the last occurrence", entry.id(), request.table());
            }
            entries.put(entry.id(), entry);
        }

        List<String> lines = new ArrayList<>(entries.size());
        for (IndexEntry entry : entries.values()) {
            try {
                lines.add(assembler.toLine(entry));
            } catch (JsonProcessingException e) {
                throw new PipelineException(PipelineStage.ASSEMBLE, e);
            }
        }

        try {
            blobStore.writeText(output, lines.isEmpty() ? "" : String.join("\n", lines) + "\n");
        } catch (IOException e) {
            throw new PipelineException(PipelineStage.WRITE_OUTPUT, e);
        }
        log.info("Embedded {} rows from {} into {} (model={}, sparse={}, skippedFields={})",
                rows.size(), request.table(), output, embeddingService.version(), sparseEncoder != null, skippedFields);
        return new EmbeddingReport(EmbeddingReport.EMBEDDED, prefix, output.uri(), rows.size(), skippedFields);
    }

    private static String nonEmpty(String text) {
        String stripped = text == null ? "" : text.strip();
        return stripped.isEmpty() ? " " : stripped;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
