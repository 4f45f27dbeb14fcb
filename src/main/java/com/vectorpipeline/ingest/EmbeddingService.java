package com.vectorpipeline.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public interface EmbeddingService {
    float[] embed(String text, EmbeddingTask task) throws IOException;

    default List<float[]> embedAll(List<String> texts, EmbeddingTask task) throws IOException {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text, task));
        }
        return vectors;
    }

    int dimension();

    default String version() {
        return "unversioned";
    }
}
