package com.dataforge.embedding;

import com.dataforge.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private static final EmbeddingService UNAVAILABLE = new EmbeddingService() {
        @Override
        public float[] embed(String text) {
            throw new IllegalStateException("Semantic embedding is disabled");
        }

        @Override
        public int dimension() {
            return 0;
        }

        @Override
        public String version() {
            return "disabled";
        }

        @Override
        public boolean isAvailable() {
            return false;
        }
    };

    private EmbeddingServices() {
    }

    public static EmbeddingService unavailable() {
        return UNAVAILABLE;
    }

    public static EmbeddingService fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        if (!config.isSemanticEnabled()) {
            return UNAVAILABLE;
        }
        String endpoint = firstNonBlank(System.getenv("DATAFORGE_EMBEDDING_URL"), config.getEndpoint());
        if (endpoint == null) {
            return new LocalModelEmbeddingService(config.getDimension());
        }
        String apiKey = System.getenv(config.getApiKeyEnv());
        return new ExternalProviderEmbeddingService(httpClient, endpoint, config.getModel(), apiKey,
                config.getDimension());
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second == null || second.isBlank() ? null : second;
    }
}
