package com.dataforge.finetune;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/**
 * Settings for one fine-tune run. Built once and never mutated; YAML and JSON documents bind through
 * {@link Builder} using snake_case keys.
 */
@JsonDeserialize(builder = FinetuneConfig.Builder.class)
public final class FinetuneConfig {
    private final boolean runDeduplication;
    private final Map<String, Object> deduplicationConfig;
    private final boolean runNoiseRemoval;
    private final Map<String, Object> noiseConfig;
    private final boolean runPiiScrubbing;
    private final Map<String, Object> piiConfig;
    private final boolean runLanguageFilter;
    private final Map<String, Object> languageConfig;
    private final boolean runQualityScoring;
    private final Map<String, Object> qualityConfig;

    private final InputFormat inputFormat;
    private final OutputFormat outputFormat;
    private final String systemPrompt;
    private final int maxTokensPerExample;
    private final String tokenizer;
    private final boolean runResponseQuality;
    private final Map<String, Object> responseQualityConfig;
    private final boolean runBalancer;
    private final Map<String, Object> balancerConfig;
    private final boolean runAugmentation;
    private final Map<String, Object> augmentationConfig;

    private final double trainSplit;
    private final double valSplit;
    private final boolean shuffle;
    private final long seed;

    private FinetuneConfig(Builder builder) {
        this.runDeduplication = builder.runDeduplication;
        this.deduplicationConfig = freeze(builder.deduplicationConfig);
        this.runNoiseRemoval = builder.runNoiseRemoval;
        this.noiseConfig = freeze(builder.noiseConfig);
        this.runPiiScrubbing = builder.runPiiScrubbing;
        this.piiConfig = freeze(builder.piiConfig);
        this.runLanguageFilter = builder.runLanguageFilter;
        this.languageConfig = freeze(builder.languageConfig);
        this.runQualityScoring = builder.runQualityScoring;
        this.qualityConfig = freeze(builder.qualityConfig);
        this.inputFormat = builder.inputFormat;
        this.outputFormat = builder.outputFormat;
        this.systemPrompt = builder.systemPrompt;
        this.maxTokensPerExample = builder.maxTokensPerExample;
        this.tokenizer = builder.tokenizer;
        this.runResponseQuality = builder.runResponseQuality;
        this.responseQualityConfig = freeze(builder.responseQualityConfig);
        this.runBalancer = builder.runBalancer;
        this.balancerConfig = freeze(builder.balancerConfig);
        this.runAugmentation = builder.runAugmentation;
        this.augmentationConfig = freeze(builder.augmentationConfig);
        this.trainSplit = builder.trainSplit;
        this.valSplit = builder.valSplit;
        this.shuffle = builder.shuffle;
        this.seed = builder.seed;
    }

    public static FinetuneConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Map<String, Object> freeze(Map<String, Object> config) {
        return config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public boolean runDeduplication() {
        return runDeduplication;
    }

    public Map<String, Object> deduplicationConfig() {
        return deduplicationConfig;
    }

    public boolean runNoiseRemoval() {
        return runNoiseRemoval;
    }

    public Map<String, Object> noiseConfig() {
        return noiseConfig;
    }

    public boolean runPiiScrubbing() {
        return runPiiScrubbing;
    }

    public Map<String, Object> piiConfig() {
        return piiConfig;
    }

    public boolean runLanguageFilter() {
        return runLanguageFilter;
    }

    public Map<String, Object> languageConfig() {
        return languageConfig;
    }

    public boolean runQualityScoring() {
        return runQualityScoring;
    }

    public Map<String, Object> qualityConfig() {
        return qualityConfig;
    }

    public InputFormat inputFormat() {
        return inputFormat;
    }

    public OutputFormat outputFormat() {
        return outputFormat;
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    public int maxTokensPerExample() {
        return maxTokensPerExample;
    }

    /** Encoding named by this config, or empty to use the application default. */
    public Optional<String> tokenizer() {
        return Optional.ofNullable(tokenizer);
    }

    public boolean runResponseQuality() {
        return runResponseQuality;
    }

    public Map<String, Object> responseQualityConfig() {
        return responseQualityConfig;
    }

    public boolean runBalancer() {
        return runBalancer;
    }

    public Map<String, Object> balancerConfig() {
        return balancerConfig;
    }

    public boolean runAugmentation() {
        return runAugmentation;
    }

    public Map<String, Object> augmentationConfig() {
        return augmentationConfig;
    }

    public double trainSplit() {
        return trainSplit;
    }

    public double valSplit() {
        return valSplit;
    }

    public boolean shuffle() {
        return shuffle;
    }

    public long seed() {
        return seed;
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private boolean runDeduplication = true;
        private Map<String, Object> deduplicationConfig = Map.of();
        private boolean runNoiseRemoval = true;
        private Map<String, Object> noiseConfig = Map.of();
        private boolean runPiiScrubbing = true;
        private Map<String, Object> piiConfig = Map.of();
        private boolean runLanguageFilter;
        private Map<String, Object> languageConfig = Map.of();
        private boolean runQualityScoring = true;
        private Map<String, Object> qualityConfig = Map.of();
        private InputFormat inputFormat = InputFormat.AUTO;
        private OutputFormat outputFormat = OutputFormat.OPENAI;
        private String systemPrompt = "";
        private int maxTokensPerExample = 4096;
        private String tokenizer;
        private boolean runResponseQuality = true;
        private Map<String, Object> responseQualityConfig = Map.of();
        private boolean runBalancer;
        private Map<String, Object> balancerConfig = Map.of();
        private boolean runAugmentation;
        private Map<String, Object> augmentationConfig = Map.of();
        private double trainSplit = 0.9;
        private double valSplit = 0.1;
        private boolean shuffle = true;
        private long seed = 42;

        private Builder() {
        }

        @JsonProperty("run_deduplication")
        public Builder runDeduplication(boolean runDeduplication) {
            this.runDeduplication = runDeduplication;
            return this;
        }

        @JsonProperty("deduplication_config")
        public Builder deduplicationConfig(Map<String, Object> deduplicationConfig) {
            this.deduplicationConfig = deduplicationConfig;
            return this;
        }

        @JsonProperty("run_noise_removal")
        public Builder runNoiseRemoval(boolean runNoiseRemoval) {
            this.runNoiseRemoval = runNoiseRemoval;
            return this;
        }

        @JsonProperty("noise_config")
        public Builder noiseConfig(Map<String, Object> noiseConfig) {
            this.noiseConfig = noiseConfig;
            return this;
        }

        @JsonProperty("run_pii_scrubbing")
        public Builder runPiiScrubbing(boolean runPiiScrubbing) {
            this.runPiiScrubbing = runPiiScrubbing;
            return this;
        }

        @JsonProperty("pii_config")
        public Builder piiConfig(Map<String, Object> piiConfig) {
            this.piiConfig = piiConfig;
            return this;
        }

        @JsonProperty("run_language_filter")
        public Builder runLanguageFilter(boolean runLanguageFilter) {
            this.runLanguageFilter = runLanguageFilter;
            return this;
        }

        @JsonProperty("language_config")
        public Builder languageConfig(Map<String, Object> languageConfig) {
            this.languageConfig = languageConfig;
            return this;
        }

        @JsonProperty("run_quality_scoring")
        public Builder runQualityScoring(boolean runQualityScoring) {
            this.runQualityScoring = runQualityScoring;
            return this;
        }

        @JsonProperty("quality_config")
        public Builder qualityConfig(Map<String, Object> qualityConfig) {
            this.qualityConfig = qualityConfig;
            return this;
        }

        @JsonProperty("input_format")
        public Builder inputFormat(InputFormat inputFormat) {
            this.inputFormat = inputFormat == null ? InputFormat.AUTO : inputFormat;
            return this;
        }

        @JsonProperty("output_format")
        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = outputFormat == null ? OutputFormat.OPENAI : outputFormat;
            return this;
        }

        @JsonProperty("system_prompt")
        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt == null ? "" : systemPrompt;
            return this;
        }

        @JsonProperty("max_tokens_per_example")
        public Builder maxTokensPerExample(int maxTokensPerExample) {
            this.maxTokensPerExample = maxTokensPerExample;
            return this;
        }

        @JsonProperty("tokenizer")
        public Builder tokenizer(String tokenizer) {
            this.tokenizer = tokenizer == null || tokenizer.isBlank() ? null : tokenizer;
            return this;
        }

        @JsonProperty("run_response_quality")
        public Builder runResponseQuality(boolean runResponseQuality) {
            this.runResponseQuality = runResponseQuality;
            return this;
        }

        @JsonProperty("response_quality_config")
        public Builder responseQualityConfig(Map<String, Object> responseQualityConfig) {
            this.responseQualityConfig = responseQualityConfig;
            return this;
        }

        @JsonProperty("run_balancer")
        public Builder runBalancer(boolean runBalancer) {
            this.runBalancer = runBalancer;
            return this;
        }

        @JsonProperty("balancer_config")
        public Builder balancerConfig(Map<String, Object> balancerConfig) {
            this.balancerConfig = balancerConfig;
            return this;
        }

        @JsonProperty("run_augmentation")
        public Builder runAugmentation(boolean runAugmentation) {
            this.runAugmentation = runAugmentation;
            return this;
        }

        @JsonProperty("augmentation_config")
        public Builder augmentationConfig(Map<String, Object> augmentationConfig) {
            this.augmentationConfig = augmentationConfig;
            return this;
        }

        @JsonProperty("train_split")
        public Builder trainSplit(double trainSplit) {
            this.trainSplit = trainSplit;
            return this;
        }

        @JsonProperty("val_split")
        public Builder valSplit(double valSplit) {
            this.valSplit = valSplit;
            return this;
        }

        @JsonProperty("shuffle")
        public Builder shuffle(boolean shuffle) {
            this.shuffle = shuffle;
            return this;
        }

        @JsonProperty("seed")
        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public FinetuneConfig build() {
            if (valSplit < 0 || valSplit >= 1) {
                throw new IllegalArgumentException("val_split must be in [0, 1): " + valSplit);
            }
            if (maxTokensPerExample <= 0) {
                throw new IllegalArgumentException("max_tokens_per_example must be positive: " + maxTokensPerExample);
            }
            return new FinetuneConfig(this);
        }
    }
}
