package io.ragent.core.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Client for the {@code /embeddings} endpoint of OpenAI-compatible servers.
 */
public final class OpenAiEmbeddingClient implements EmbeddingClient {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String apiKey;
    private final HttpUrl apiBase;
    private final String model;
    private final int batchSize;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public OpenAiEmbeddingClient(String apiKey, String apiBase, String model) {
        this(apiKey, apiBase, model, 64);
    }

    public OpenAiEmbeddingClient(String apiKey, String apiBase, String model, int batchSize) {
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.batchSize = Math.max(1, batchSize);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(120))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public List<float[]> embed(List<String> inputs) throws IOException {
        List<float[]> vectors = new ArrayList<>(inputs.size());
        for (int start = 0; start < inputs.size(); start += batchSize) {
            vectors.addAll(embedBatch(inputs.subList(start, Math.min(inputs.size(), start + batchSize))));
        }
        return vectors;
    }

    private List<float[]> embedBatch(List<String> batch) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", batch);

        Request.Builder builder = new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("embeddings").build())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("Content-Type", "application/json");
        if (!apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = client.newCall(builder.build()).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new IOException("Embedding request failed: HTTP " + response.code() + " " + body);
            }
            return parse(body, batch.size());
        }
    }

    private List<float[]> parse(String body, int expected) throws IOException {
        JsonNode data = mapper.readTree(body).path("data");
        if (!data.isArray() || data.size() != expected) {
            throw new IOException("Embedding response has " + data.size() + " vectors, expected " + expected);
        }
        float[][] ordered = new float[expected][];
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            int index = item.path("index").asInt(i);
            JsonNode values = item.path("embedding");
            float[] vector = new float[values.size()];
            for (int j = 0; j < values.size(); j++) {
                vector[j] = (float) values.get(j).asDouble();
            }
            ordered[index] = vector;
        }
        List<float[]> vectors = new ArrayList<>(expected);
        for (float[] vector : ordered) {
            if (vector == null) {
                throw new IOException("Embedding response is missing an index");
            }
            vectors.add(vector);
        }
        return vectors;
    }
}
