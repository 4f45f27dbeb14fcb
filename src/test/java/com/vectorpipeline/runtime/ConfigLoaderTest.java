package com.vectorpipeline.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldUseDefaultsWhenFileIsMissing() throws Exception {
        AppConfig config = ConfigLoader.load(tempDir.resolve("missing.yml"));

        assertEquals(768, config.getEmbedding().getOutputDimensionality());
        assertEquals(List.of("created_at", "updated_at"), config.getFilters().getTimestampFields());
        assertFalse(config.getSparse().isEnabled());
        assertEquals(65536, config.getSparse().getBucketCount());
        assertEquals("DOT_PRODUCT", config.getIndexDefaults().getDistanceMeasureType());
        assertEquals(10, config.getSearch().getDefaultTopK());
    }

    @Test
    void shouldReadNestedSectionsAndIgnoreUnknownKeys() throws Exception {
        Path file = tempDir.resolve("application.yml");
        Files.writeString(file, """
                project:
                  projectId: demo
                embedding:
                  outputDimensionality: 512
                  textFields: [title, body]
                  metadataFields: [id, title]
                filters:
                  restrictsFields: [category]
                  timestampZone: Europe/Berlin
                sparse:
                  enabled: true
                  bucketCount: 1024
                resourceNames:
                  indexId: idx-1
                  endpointId: ep-1
                  deployedIndexId: dep-1
                batchPaths:
                  batchRoot: gs://bucket/batch
                somethingElse:
                  ignored: true
                """);

        AppConfig config = ConfigLoader.load(file);

        assertEquals("demo", config.getProject().getProjectId());
        assertEquals("us-central1", config.getProject().getRegion());
        assertEquals(512, config.getEmbedding().getOutputDimensionality());
        assertEquals(List.of("title", "body"), config.getEmbedding().getTextFields());
        assertEquals(List.of("category"), config.getFilters().getRestrictsFields());
        assertTrue(config.getFilters().getNumericRestrictsFields().isEmpty());
        assertEquals("Europe/Berlin", config.getFilters().getTimestampZone());
        assertTrue(config.getSparse().isEnabled());
        assertEquals(1024, config.getSparse().getBucketCount());
        assertEquals("idx-1", config.getResourceNames().getIndexId());
        assertEquals("gs://bucket/batch", config.getBatchPaths().getBatchRoot());
    }

    @Test
    void shouldRejectInvalidValues() throws Exception {
        Path badBuckets = tempDir.resolve("buckets.yml");
        Files.writeString(badBuckets, "sparse:\n  bucketCount: 0\n");
        Path badZone = tempDir.resolve("zone.yml");
        Files.writeString(badZone, "filters:\n  timestampZone: Mars/Olympus\n");

        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(badBuckets));
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(badZone));
    }
}
