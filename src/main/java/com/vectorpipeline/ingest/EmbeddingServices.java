package com.vectorpipeline.ingest;

import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    static final String ENDPOINT_VARIABLE = "VECTORPIPE_EMBEDDING_URL";
    static final String API_KEY_VARIABLE = "VECTORPIPE_EMBEDDING_API_KEY";

    private EmbeddingServices() {
    }

    public static EmbeddingService fromEnvironment(OkHttpClient httpClient, ObjectMapper mapper, String model, int dimension) {
        return fromVariables(System.getenv(), httpClient, mapper, model, dimension);
    }

    static EmbeddingService fromVariables(Map<String, String> env,
            OkHttpClient httpClient,
            ObjectMapper mapper,
            String model,
            int dimension) {
        String endpoint = env.get(ENDPOINT_VARIABLE);
        if (endpoint == null || endpoint.isBlank()) {
            return new HashingEmbeddingService(dimension);
        }
        return new ExternalProviderEmbeddingService(httpClient, mapper, endpoint, model, env.get(API_KEY_VARIABLE), dimension);
    }
}
