package com.dataforge.finetune;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.dataforge.dataset.Dataset;

/**
 * Outcome of a fine-tune run. {@code outputFiles} holds relative artifact identifiers keyed by {@code train},
 * {@code val} (only when the validation split is non-empty) and {@code config}.
 */
public record FinetunePipelineResult(
        Dataset train,
        Dataset validation,
        OutputFormat outputFormat,
        int totalExamples,
        int trainExamples,
        int valExamples,
        double avgTokens,
        String estimatedTrainingTime,
        Map<String, String> outputFiles,
        List<StepStats> stepStats,
        List<String> warnings) {

    public FinetunePipelineResult {
        outputFiles = Collections.unmodifiableMap(new LinkedHashMap<>(outputFiles));
        stepStats = List.copyOf(stepStats);
        warnings = List.copyOf(warnings);
    }

    public Optional<String> outputFile(String key) {
        return Optional.ofNullable(outputFiles.get(key));
    }

    public record StepStats(String step, boolean skipped, int rowsBefore, int rowsAfter, Map<String, Object> metadata,
            List<String> warnings) {
        public StepStats {
            metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
            warnings = List.copyOf(warnings);
        }
    }
}
