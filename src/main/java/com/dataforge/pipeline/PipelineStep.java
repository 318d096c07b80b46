package com.dataforge.pipeline;

import java.util.Map;

import com.dataforge.dataset.Dataset;

/**
 * A named, stateless transform from one {@link Dataset} to a {@link StepResult}.
 * Implementations never mutate the dataset they receive.
 */
public interface PipelineStep {
    String name();

    String description();

    default void validateConfig(Map<String, Object> config) {
    }

    StepResult run(Dataset dataset, Map<String, Object> config);
}
