package com.dataforge.finetune;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Recommended base model and hyperparameters for the exported dataset.
 */
public record TrainingConfigDescriptor(
        @JsonProperty("model_recommendation") String modelRecommendation,
        @JsonProperty("dataset_format") String datasetFormat,
        @JsonProperty("num_examples") int numExamples,
        @JsonProperty("avg_tokens") double avgTokens,
        @JsonProperty("recommended_epochs") int recommendedEpochs,
        @JsonProperty("recommended_batch_size") int recommendedBatchSize,
        @JsonProperty("recommended_learning_rate") double recommendedLearningRate,
        @JsonProperty("frameworks") Map<String, String> frameworks) {

    static final int BATCH_SIZE = 4;
    static final double LEARNING_RATE = 2e-4;

    public static TrainingConfigDescriptor recommend(int numExamples, double avgTokens, OutputFormat format) {
        String model = switch (format) {
            case MISTRAL -> "mistralai/Mistral-7B-Instruct-v0.2";
            case GEMMA -> "google/gemma-7b-it";
            default -> "meta-llama/Meta-Llama-3-8B-Instruct";
        };
        int epochs = numExamples > 5000 ? 3 : numExamples > 1000 ? 5 : 10;
        Map<String, String> frameworks = new LinkedHashMap<>();
        frameworks.put("unsloth", "from unsloth import FastLanguageModel\n"
                + "model = FastLanguageModel.from_pretrained(model_name='" + model + "'...)");
        frameworks.put("axolotl", "base_model: " + model + "\n"
                + "datasets:\n"
                + "  - path: train.jsonl\n"
                + "    type: " + format.id() + "\n"
                + "epochs: " + epochs + "\n"
                + "micro_batch_size: " + BATCH_SIZE + "\n"
                + "learning_rate: 0.0002");
        return new TrainingConfigDescriptor(
                model,
                format.id(),
                numExamples,
                Math.round(avgTokens * 10.0) / 10.0,
                epochs,
                BATCH_SIZE,
                LEARNING_RATE,
                frameworks);
    }
}
