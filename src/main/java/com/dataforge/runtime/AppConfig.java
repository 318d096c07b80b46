package com.dataforge.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ScoringConfig scoring = new ScoringConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private PiiConfig pii = new PiiConfig();
    private LanguageConfig language = new LanguageConfig();
    private FinetuneDefaults finetune = new FinetuneDefaults();

    public ScoringConfig getScoring() {
        return scoring;
    }

    public void setScoring(ScoringConfig scoring) {
        this.scoring = scoring == null ? new ScoringConfig() : scoring;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public PiiConfig getPii() {
        return pii;
    }

    public void setPii(PiiConfig pii) {
        this.pii = pii == null ? new PiiConfig() : pii;
    }

    public LanguageConfig getLanguage() {
        return language;
    }

    public void setLanguage(LanguageConfig language) {
        this.language = language == null ? new LanguageConfig() : language;
    }

    public FinetuneDefaults getFinetune() {
        return finetune;
    }

    public void setFinetune(FinetuneDefaults finetune) {
        this.finetune = finetune == null ? new FinetuneDefaults() : finetune;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScoringConfig {
        private String endpoint = "";
        private String model = "gpt-3.5-turbo";
        private String apiKeyEnv = "DATAFORGE_SCORING_API_KEY";
        private int timeoutMs = 60000;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private boolean semanticEnabled = true;
        private int dimension = 384;
        private String endpoint = "";
        private String model = "all-MiniLM-L6-v2";
        private String apiKeyEnv = "DATAFORGE_EMBEDDING_API_KEY";

        public boolean isSemanticEnabled() {
            return semanticEnabled;
        }

        public void setSemanticEnabled(boolean semanticEnabled) {
            this.semanticEnabled = semanticEnabled;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PiiConfig {
        private boolean nerEnabled = true;
        private Map<String, String> nerModels = defaultNerModels();

        private static Map<String, String> defaultNerModels() {
            Map<String, String> models = new LinkedHashMap<>();
            models.put("PERSON", "opennlp_models/en-ner-person.bin");
            models.put("LOCATION", "opennlp_models/en-ner-location.bin");
            models.put("ORGANIZATION", "opennlp_models/en-ner-organization.bin");
            return models;
        }

        public boolean isNerEnabled() {
            return nerEnabled;
        }

        public void setNerEnabled(boolean nerEnabled) {
            this.nerEnabled = nerEnabled;
        }

        public Map<String, String> getNerModels() {
            return nerModels;
        }

        public void setNerModels(Map<String, String> nerModels) {
            this.nerModels = nerModels == null ? new LinkedHashMap<>() : nerModels;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LanguageConfig {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FinetuneDefaults {
        private String outputDir = ".dataforge/exports";
        private String tokenizer = "cl100k_base";
        private double tokensPerSecond = 5000.0;
        private int estimateEpochs = 3;

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }

        public String getTokenizer() {
            return tokenizer;
        }

        public void setTokenizer(String tokenizer) {
            this.tokenizer = tokenizer;
        }

        public double getTokensPerSecond() {
            return tokensPerSecond;
        }

        public void setTokensPerSecond(double tokensPerSecond) {
            this.tokensPerSecond = tokensPerSecond;
        }

        public int getEstimateEpochs() {
            return estimateEpochs;
        }

        public void setEstimateEpochs(int estimateEpochs) {
            this.estimateEpochs = estimateEpochs;
        }
    }
}
