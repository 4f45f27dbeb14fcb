package com.vectorpipeline.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalBlobStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldListWrittenBlobsUnderPrefixInNameOrder() throws Exception {
        LocalBlobStore store = new LocalBlobStore(tempDir);
        store.writeText(BlobLocation.parse("gs://b/batch/part-00001.json"), "two");
        store.writeText(BlobLocation.parse("gs://b/batch/part-00000.json"), "one");
        store.writeText(BlobLocation.parse("gs://b/batchy/other.json"), "other");

        List<BlobLocation> listed = store.list(BlobLocation.parse("gs://b/batch"));

        assertEquals(List.of(
                new BlobLocation("b", "batch/part-00000.json"),
                new BlobLocation("b", "batch/part-00001.json")), listed);
        assertEquals("one", store.readText(listed.get(0)));
    }

    @Test
    void shouldReturnNothingForMissingPrefix() throws Exception {
        assertTrue(new LocalBlobStore(tempDir).list(BlobLocation.parse("gs://b/none")).isEmpty());
    }

    @Test
    void shouldRefusePathsOutsideTheBucket() {
        LocalBlobStore store = new LocalBlobStore(tempDir);

        assertThrows(IllegalArgumentException.class,
                () -> store.writeText(BlobLocation.parse("gs://b/../escape.json"), "x"));
    }
}
