package com.dataforge.scoring;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Scores batches through an OpenAI-compatible {@code /chat/completions} endpoint.
 */
public class ChatCompletionScoringService implements AiScoringService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int PROMPT_EXAMPLE_CHARS = 500;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String model;
    private final String apiKey;

    public ChatCompletionScoringService(OkHttpClient httpClient, String endpoint, String model, String apiKey) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    public List<AiScore> scoreBatch(List<String> texts) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", List.of(Map.of("role", "user", "content", buildPrompt(texts))));
        payload.put("temperature", 0.1);
        payload.put("response_format", Map.of("type", "json_object"));

        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (response.code() == 429) {
                throw new RateLimitedException("Rate limited by scoring provider (HTTP 429)");
            }
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("Scoring provider returned HTTP " + response.code());
            }
            JsonNode root = mapper.readTree(response.body().string());
            String content = root.path("choices").path(0).path("message").path("content").asText("");
            return parseScores(content);
        }
    }

    static String buildPrompt(List<String> texts) {
        StringBuilder examples = new StringBuilder();
        for (int i = 0; i < texts.size(); i++) {
            if (i > 0) {
                examples.append("\n---\n");
            }
            String text = texts.get(i);
            examples.append("Example ")
                    .append(i + 1)
                    .append(": ")
                    .append(text.length() > PROMPT_EXAMPLE_CHARS ? text.substring(0, PROMPT_EXAMPLE_CHARS) : text);
        }
        return "Evaluate each example for quality, relevance, and usefulness for AI training.\n"
                + "Score each 0-10. Return a JSON array of objects: [{\"score\": float, \"reason\": str}]\n\n"
                + examples;
    }

    List<AiScore> parseScores(String content) throws IOException {
        JsonNode parsed = mapper.readTree(content);
        if (parsed != null && parsed.isObject() && parsed.has("results")) {
            parsed = parsed.get("results");
        }
        if (parsed == null || !parsed.isArray()) {
            throw new IOException("Scoring response is not a JSON array");
        }
        List<AiScore> scores = new ArrayList<>(parsed.size());
        for (JsonNode item : parsed) {
            scores.add(new AiScore(item.path("score").asDouble(5.0), item.path("reason").asText("")));
        }
        return scores;
    }
}
