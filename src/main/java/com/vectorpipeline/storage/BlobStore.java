package com.vectorpipeline.storage;

import java.io.IOException;
import java.util.List;

/**
 * Object storage holding JSON-lines datapoint files.
 */
public interface BlobStore {
    /**
     * Lists objects under {@code prefix/} in name order.
     */
    List<BlobLocation> list(BlobLocation prefix) throws IOException;

    String readText(BlobLocation blob) throws IOException;

    void writeText(BlobLocation blob, String content) throws IOException;
}
