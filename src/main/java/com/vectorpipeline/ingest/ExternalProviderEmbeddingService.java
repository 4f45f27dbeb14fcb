package com.vectorpipeline.ingest;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Calls an HTTP embedding endpoint that accepts {@code {"input", "task_type", "output_dimensionality", "model"}}
 * and answers with {@code {"embedding": [...]}}. Failures are reported to the caller as {@link IOException}.
 */
public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient,
            ObjectMapper mapper,
            String endpoint,
            String model,
            String apiKey,
            int dimension) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text, EmbeddingTask task) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("input", text);
        body.put("task_type", task.name());
        body.put("output_dimensionality", dimension);
        body.put("model", model);
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(mapper.writeValueAsString(body), JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("Embedding endpoint " + endpoint + " answered HTTP " + response.code());
            }
            JsonNode vectorNode = mapper.readTree(response.body().string()).path("embedding");
            if (!vectorNode.isArray() || vectorNode.isEmpty()) {
                throw new IOException("Embedding endpoint " + endpoint + " returned no embedding array");
            }
            float[] out = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                out[i] = (float) vectorNode.get(i).asDouble();
            }
            return out;
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "external-" + model;
    }
}
