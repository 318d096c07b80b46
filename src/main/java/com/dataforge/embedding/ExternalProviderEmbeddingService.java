package com.dataforge.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Embeds text through an OpenAI-compatible {@code /embeddings} endpoint. Provider failures are reported as
 * {@link IOException}s instead of being patched over with vectors from another model.
 */
public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(ExternalProviderEmbeddingService.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    static final int BATCH_SIZE = 64;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String model,
            String apiKey,
            int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive");
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) throws IOException {
        return request(List.of(text == null ? "" : text)).get(0);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) throws IOException {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += BATCH_SIZE) {
            List<String> batch = new ArrayList<>();
            for (String text : texts.subList(start, Math.min(texts.size(), start + BATCH_SIZE))) {
                batch.add(text == null ? "" : text);
            }
            vectors.addAll(request(batch));
        }
        return vectors;
    }

    private List<float[]> request(List<String> inputs) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("input", inputs.size() == 1 ? inputs.get(0) : inputs);
        payload.put("model", model);
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.warn("embedding.external.rejected endpoint={} status={}", endpoint, response.code());
                throw new IOException("Embedding provider returned HTTP " + response.code());
            }
            List<JsonNode> vectorNodes = vectorNodes(mapper.readTree(response.body().string()));
            if (vectorNodes.size() != inputs.size()) {
                throw new IOException("Embedding provider returned " + vectorNodes.size() + " vectors for "
                        + inputs.size() + " inputs");
            }
            List<float[]> vectors = new ArrayList<>(vectorNodes.size());
            for (JsonNode node : vectorNodes) {
                vectors.add(toVector(node));
            }
            log.debug("embedding.external.batch endpoint={} size={}", endpoint, vectors.size());
            return vectors;
        }
    }

    private float[] toVector(JsonNode node) throws IOException {
        if (!node.isArray()) {
            throw new IOException("Embedding provider response has no embedding array");
        }
        if (node.size() != dimension) {
            throw new IOException("Embedding provider returned " + node.size() + " dimensions, expected "
                    + dimension);
        }
        float[] out = new float[node.size()];
        for (int i = 0; i < node.size(); i++) {
            out[i] = (float) node.get(i).asDouble();
        }
        return out;
    }

    private static List<JsonNode> vectorNodes(JsonNode root) {
        JsonNode direct = root.path("embedding");
        if (direct.isArray()) {
            return List.of(direct);
        }
        List<JsonNode> nodes = new ArrayList<>();
        root.path("data").forEach(item -> nodes.add(item.path("embedding")));
        return nodes;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "external-" + model + "-v1";
    }
}
