package com.dataforge.finetune;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;
import com.dataforge.pipeline.PipelineInputException;
import com.dataforge.pipeline.PipelineRunResult;
import com.dataforge.pipeline.PipelineRunner;
import com.dataforge.pipeline.ProgressListener;
import com.dataforge.pipeline.StepConfig;
import com.dataforge.pipeline.StepRegistry;
import com.dataforge.pipeline.StepResult;
import com.dataforge.pipeline.common.DeduplicationStep;
import com.dataforge.pipeline.common.LanguageFilterStep;
import com.dataforge.pipeline.common.NoiseRemovalStep;
import com.dataforge.pipeline.common.PiiScrubberStep;
import com.dataforge.pipeline.common.QualityScorerStep;
import com.dataforge.runtime.AppConfig;

/**
 * Fine-tune preparation: common cleaning steps, then formatting, response filtering, balancing and augmentation,
 * then a train/validation split and export. Progress runs 10-40 for cleaning, 40-80 for fine-tune steps, 85 for
 * the split, 90 for export and 100 at the end.
 */
public class FinetunePipelineRunner {
    private static final Logger log = LoggerFactory.getLogger(FinetunePipelineRunner.class);

    private final PipelineRunner pipelineRunner;
    private final FinetuneExporter exporter;
    private final Path outputDirectory;
    private final AppConfig.FinetuneDefaults defaults;

    public FinetunePipelineRunner(
            StepRegistry registry,
            FinetuneExporter exporter,
            Path outputDirectory,
            AppConfig.FinetuneDefaults defaults) {
        this.pipelineRunner = new PipelineRunner(registry);
        this.exporter = exporter;
        this.outputDirectory = outputDirectory;
        this.defaults = defaults;
    }

    public FinetunePipelineResult run(Dataset dataset, FinetuneConfig config, String jobId, ProgressListener progress)
            throws IOException {
        if (dataset == null || dataset.isEmpty()) {
            throw new PipelineInputException("Dataset is empty; nothing to prepare for fine-tuning");
        }
        ProgressListener listener = progress == null ? ProgressListener.NONE : progress;
        log.info("finetune.started job={} rows={} outputFormat={}", jobId, dataset.rowCount(), config.outputFormat().id());

        List<FinetunePipelineResult.StepStats> stats = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Dataset current = dataset;

        List<StepConfig> commonSteps = commonSteps(config);
        if (!commonSteps.isEmpty()) {
            notify(listener, 10, "common", "Running common preprocessing...");
            PipelineRunResult common = pipelineRunner.run(current, commonSteps, jobId, listener.scaled(10, 40));
            current = common.dataset();
            warnings.addAll(common.warnings());
            collect(commonSteps, common, stats);
        }

        List<StepConfig> finetuneSteps = finetuneSteps(config, defaults.getTokenizer());
        PipelineRunResult finetune = pipelineRunner.run(current, finetuneSteps, jobId, listener.scaled(40, 80));
        current = finetune.dataset();
        warnings.addAll(finetune.warnings());
        collect(finetuneSteps, finetune, stats);

        double avgTokens = averageTokens(finetuneSteps, finetune);
        String stratifyColumn = categoryColumn(finetuneSteps, finetune);

        notify(listener, 85, "split", "Splitting dataset into train/val...");
        TrainValSplitter splitter = new TrainValSplitter(config.valSplit(), config.shuffle(), config.seed());
        TrainValSplitter.Split split = splitter.split(current, stratifyColumn);
        int total = split.train().rowCount() + split.validation().rowCount();
        log.info("finetune.split job={} train={} val={} stratified={}",
                jobId, split.train().rowCount(), split.validation().rowCount(), split.stratified());

        notify(listener, 90, "export", "Exporting target formats...");
        Map<String, String> outputFiles = export(split, config.outputFormat(), total, avgTokens, jobId);

        String estimate = estimateTrainingTime(total, avgTokens);
        notify(listener, 100, "done", "Fine-tune dataset ready: " + total + " examples");
        log.info("finetune.completed job={} total={} avgTokens={} estimate=\"{}\" warnings={}",
                jobId, total, avgTokens, estimate, warnings.size());
        return new FinetunePipelineResult(
                split.train(),
                split.validation(),
                config.outputFormat(),
                total,
                split.train().rowCount(),
                split.validation().rowCount(),
                avgTokens,
                estimate,
                outputFiles,
                stats,
                warnings);
    }

    static List<StepConfig> commonSteps(FinetuneConfig config) {
        List<StepConfig> steps = new ArrayList<>();
        if (config.runDeduplication()) {
            steps.add(StepConfig.of(DeduplicationStep.NAME, config.deduplicationConfig()));
        }
        if (config.runNoiseRemoval()) {
            steps.add(StepConfig.of(NoiseRemovalStep.NAME, config.noiseConfig()));
        }
        if (config.runPiiScrubbing()) {
            steps.add(StepConfig.of(PiiScrubberStep.NAME, config.piiConfig()));
        }
        if (config.runLanguageFilter()) {
            steps.add(StepConfig.of(LanguageFilterStep.NAME, config.languageConfig()));
        }
        if (config.runQualityScoring()) {
            steps.add(StepConfig.of(QualityScorerStep.NAME, config.qualityConfig()));
        }
        return steps;
    }

    static List<StepConfig> finetuneSteps(FinetuneConfig config, String defaultTokenizer) {
        Map<String, Object> formatter = new LinkedHashMap<>();
        formatter.put("input_format", config.inputFormat().id());
        formatter.put("output_format", config.outputFormat().id());
        formatter.put("system_prompt", config.systemPrompt());
        formatter.put("max_tokens_per_example", config.maxTokensPerExample());
        formatter.put("tokenizer", config.tokenizer().orElse(defaultTokenizer));

        List<StepConfig> steps = new ArrayList<>();
        steps.add(StepConfig.of(FinetuneFormatterStep.NAME, formatter));
        if (config.runResponseQuality()) {
            steps.add(StepConfig.of(ResponseQualityStep.NAME, config.responseQualityConfig()));
        }
        if (config.runBalancer()) {
            steps.add(StepConfig.of(CategoryBalancerStep.NAME, config.balancerConfig()));
        }
        if (config.runAugmentation()) {
            steps.add(StepConfig.of(DataAugmentorStep.NAME, config.augmentationConfig()));
        }
        return steps;
    }

    String estimateTrainingTime(int totalExamples, double avgTokens) {
        double hours = totalExamples * avgTokens * defaults.getEstimateEpochs() / defaults.getTokensPerSecond() / 3600;
        return hours >= 0.1 ? String.format(Locale.ROOT, "~%.1f hours", hours) : "< 6 mins";
    }

    private Map<String, String> export(
            TrainValSplitter.Split split, OutputFormat format, int total, double avgTokens, String jobId)
            throws IOException {
        Map<String, String> outputFiles = new LinkedHashMap<>();
        String trainName = jobId + "_train.jsonl";
        exporter.export(split.train(), format, outputDirectory.resolve(trainName));
        outputFiles.put("train", trainName);
        if (!split.validation().isEmpty()) {
            String valName = jobId + "_val.jsonl";
            exporter.export(split.validation(), format, outputDirectory.resolve(valName));
            outputFiles.put("val", valName);
        }
        String configName = jobId + "_training_config.json";
        exporter.exportTrainingConfig(
                TrainingConfigDescriptor.recommend(total, avgTokens, format), outputDirectory.resolve(configName));
        outputFiles.put("config", configName);
        return outputFiles;
    }

    private static void collect(
            List<StepConfig> steps, PipelineRunResult run, List<FinetunePipelineResult.StepStats> stats) {
        for (int i = 0; i < steps.size(); i++) {
            StepResult result = run.stepResults().get(i);
            stats.add(new FinetunePipelineResult.StepStats(
                    steps.get(i).step(),
                    result.isSkipped(),
                    result.rowsBefore(),
                    result.rowsAfter(),
                    result.metadata(),
                    result.warnings()));
        }
    }

    private static double averageTokens(List<StepConfig> steps, PipelineRunResult run) {
        StepResult formatter = resultFor(FinetuneFormatterStep.NAME, steps, run);
        if (formatter != null && formatter.metadata().get("avg_token_count") instanceof Number average) {
            return average.doubleValue();
        }
        return 0.0;
    }

    private static String categoryColumn(List<StepConfig> steps, PipelineRunResult run) {
        StepResult balancer = resultFor(CategoryBalancerStep.NAME, steps, run);
        if (balancer == null || balancer.isSkipped()) {
            return null;
        }
        Object column = balancer.metadata().get(CategoryBalancerStep.CATEGORY_COLUMN_KEY);
        return column instanceof String name && run.dataset().hasColumn(name) ? name : null;
    }

    private static StepResult resultFor(String name, List<StepConfig> steps, PipelineRunResult run) {
        for (int i = 0; i < steps.size(); i++) {
            if (name.equals(steps.get(i).step())) {
                return run.stepResults().get(i);
            }
        }
        return null;
    }

    private static void notify(ProgressListener listener, int percent, String step, String message) {
        try {
            listener.onProgress(percent, step, message);
        } catch (RuntimeException e) {
            log.warn("finetune.progress.failed step={} percent={} reason={}", step, percent, e.getMessage());
        }
    }
}
