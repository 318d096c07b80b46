package com.dataforge.scoring;

import java.io.IOException;
import java.util.List;

import com.dataforge.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class AiScoringServices {
    private static final AiScoringService UNAVAILABLE = new AiScoringService() {
        @Override
        public List<AiScore> scoreBatch(List<String> texts) throws IOException {
            throw new IOException("No AI scoring service configured");
        }

        @Override
        public boolean isAvailable() {
            return false;
        }
    };

    private AiScoringServices() {
    }

    public static AiScoringService unavailable() {
        return UNAVAILABLE;
    }

    public static AiScoringService fromConfig(AppConfig.ScoringConfig config, OkHttpClient httpClient) {
        String endpoint = config.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            return UNAVAILABLE;
        }
        String apiKey = System.getenv(config.getApiKeyEnv());
        return new ChatCompletionScoringService(httpClient, endpoint, config.getModel(), apiKey);
    }
}
