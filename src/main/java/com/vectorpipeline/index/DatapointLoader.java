package com.vectorpipeline.index;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vectorpipeline.ingest.DatapointAssembler;
import com.vectorpipeline.ingest.IndexEntry;
import com.vectorpipeline.storage.BlobLocation;
import com.vectorpipeline.storage.BlobStore;

/**
 * Reads every JSON-lines datapoint file under a storage prefix. Lines that do not parse into a
 * datapoint are skipped and counted.
 */
public class DatapointLoader {
    private static final Logger log = LoggerFactory.getLogger(DatapointLoader.class);

    private final BlobStore blobStore;
    private final DatapointAssembler assembler;

    public DatapointLoader(BlobStore blobStore, DatapointAssembler assembler) {
        this.blobStore = blobStore;
        this.assembler = assembler;
    }

    public Loaded load(BlobLocation prefix) throws IOException {
        List<BlobLocation> files = blobStore.list(prefix);
        List<IndexEntry> entries = new ArrayList<>();
        int skipped = 0;
        for (BlobLocation file : files) {
            int lineCount = 0;
            for (String line : blobStore.readText(file).split("\\R")) {
                String trimmed = line.strip();
                if (trimmed.isEmpty()) {
                    continue;
                }
                lineCount++;
                try {
                    entries.add(assembler.parseLine(trimmed));
                } catch (IOException | IllegalArgumentException e) {
                    skipped++;
                    log.warn("Skipping malformed datapoint line {} of {}: {}", lineCount, file, e.getMessage());
                }
            }
            log.info("Loaded {} lines from {}", lineCount, file);
        }
        return new Loaded(entries, skipped, files);
    }

    public record Loaded(List<IndexEntry> entries, int skipped, List<BlobLocation> files) {
    }
}
