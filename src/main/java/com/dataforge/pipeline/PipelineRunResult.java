package com.dataforge.pipeline;

import java.util.List;
import java.util.Map;

import com.dataforge.dataset.Dataset;

public record PipelineRunResult(
        Dataset dataset,
        List<StepResult> stepResults,
        int totalRowsBefore,
        int totalRowsAfter,
        int totalRowsRemoved,
        Map<String, Integer> pipelineStats,
        List<String> warnings,
        double durationSeconds) {

    public PipelineRunResult {
        stepResults = List.copyOf(stepResults);
        pipelineStats = Map.copyOf(pipelineStats);
        warnings = List.copyOf(warnings);
    }

    public int stepsExecuted() {
        return pipelineStats.getOrDefault("steps_executed", 0);
    }

    public int stepsSkipped() {
        return pipelineStats.getOrDefault("steps_skipped", 0);
    }
}
