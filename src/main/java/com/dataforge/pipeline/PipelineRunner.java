package com.dataforge.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;

/**
 * Runs step configs in order. A step that is unknown, misconfigured or throws is recorded as skipped and the
 * last good dataset is carried forward; the run itself never aborts.
 */
public class PipelineRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final StepRegistry registry;

    public PipelineRunner(StepRegistry registry) {
        this.registry = registry;
    }

    public PipelineRunResult run(Dataset input, List<StepConfig> steps, String jobId, ProgressListener progress) {
        long start = System.nanoTime();
        ProgressListener listener = progress == null ? ProgressListener.NONE : progress;
        Dataset current = input;
        List<StepResult> results = new ArrayList<>(steps.size());
        List<String> warnings = new ArrayList<>();
        int total = steps.size();

        for (int i = 0; i < total; i++) {
            StepConfig stepConfig = steps.get(i);
            String stepName = stepConfig.step();
            int startPercent = i * 100 / total;
            int endPercent = (i + 1) * 100 / total;

            log.info("pipeline.step.start job={} index={} total={} step={}", jobId, i + 1, total, stepName);
            notify(listener, startPercent, stepName, "Starting " + stepName + "...");

            Optional<PipelineStep> step = registry.lookup(stepName);
            if (step.isEmpty()) {
                String warning = "Unknown step '" + stepName + "' - skipped";
                log.warn("pipeline.step.unknown job={} step={}", jobId, stepName);
                warnings.add(warning);
                results.add(StepResult.skipped(current, "unknown step", warning));
                notify(listener, endPercent, stepName, stepName + ": SKIPPED (unknown step)");
                continue;
            }

            try {
                step.get().validateConfig(stepConfig.config());
                StepResult result = step.get().run(current, stepConfig.config());
                results.add(result);
                current = result.dataset();
                warnings.addAll(result.warnings());
                log.info("pipeline.step.completed job={} step={} summary=\"{}\" warnings={}",
                        jobId, stepName, result.summary(), result.warnings().size());
                notify(listener, endPercent, stepName, stepName + ": " + result.summary());
            } catch (RuntimeException e) {
                String warning = "Step '" + stepName + "' failed: " + e.getMessage();
                log.error("pipeline.step.failed job={} step={} reason={}", jobId, stepName, e.getMessage(), e);
                warnings.add(warning);
                results.add(StepResult.skipped(current, String.valueOf(e.getMessage()), warning));
                notify(listener, endPercent, stepName, stepName + ": SKIPPED (" + e.getMessage() + ")");
            }
        }

        int skipped = (int) results.stream().filter(StepResult::isSkipped).count();
        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("steps_executed", results.size() - skipped);
        stats.put("steps_skipped", skipped);
        double duration = Math.round((System.nanoTime() - start) / 10_000_000d) / 100d;

        log.info("pipeline.completed job={} rowsBefore={} rowsAfter={} executed={} skipped={} durationSec={}",
                jobId, input.rowCount(), current.rowCount(), results.size() - skipped, skipped, duration);
        return new PipelineRunResult(
                current,
                results,
                input.rowCount(),
                current.rowCount(),
                input.rowCount() - current.rowCount(),
                stats,
                warnings,
                duration);
    }

    private static void notify(ProgressListener listener, int percent, String step, String message) {
        try {
            listener.onProgress(percent, step, message);
        } catch (RuntimeException e) {
            log.warn("pipeline.progress.failed step={} percent={} reason={}", step, percent, e.getMessage());
        }
    }
}
