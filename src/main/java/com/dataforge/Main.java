package com.dataforge;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;
import com.dataforge.dataset.DatasetLoader;
import com.dataforge.finetune.FinetuneConfig;
import com.dataforge.finetune.FinetuneExporter;
import com.dataforge.finetune.FinetunePipelineResult;
import com.dataforge.finetune.FinetunePipelineRunner;
import com.dataforge.pipeline.PipelineInputException;
import com.dataforge.pipeline.PipelineRunResult;
import com.dataforge.pipeline.PipelineRunner;
import com.dataforge.pipeline.ProgressListener;
import com.dataforge.pipeline.StepConfig;
import com.dataforge.pipeline.StepRegistry;
import com.dataforge.pipeline.StepResult;
import com.dataforge.runtime.AppConfig;
import com.dataforge.runtime.StepRegistries;
import com.dataforge.runtime.StepServices;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "dataforge",
        mixinStandardHelpOptions = true,
        version = "dataforge 0.1.0",
        description = "Prepare raw datasets for ML training with configurable cleaning pipelines.")
public class Main implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_RUN_FAILED = 3;
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "steps")
    Mode mode;

    @Option(names = { "-i", "--input" }, description = "Dataset file (.json, .jsonl, .csv, .tsv)")
    Path input;

    @Option(names = { "-w", "--workflow" }, description = "YAML/JSON list of {step, config} entries for clean mode")
    Path workflow;

    @Option(names = "--finetune-config", description = "YAML/JSON fine-tune settings; defaults apply when omitted")
    Path finetuneConfig;

    @Option(names = { "-o", "--output-dir" }, description = "Directory for processed data, artifacts and reports")
    Path outputDir;

    @Option(names = "--job-id", description = "Identifier used in logs and artifact names")
    String jobId;

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ObjectMapper jsonMapper = new ObjectMapper();

    enum Mode {
        clean,
        finetune,
        steps
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(configPath);
        String job = jobId == null || jobId.isBlank() ? "job-" + System.currentTimeMillis() : jobId;
        Path output = outputDir != null ? outputDir : Path.of(config.getFinetune().getOutputDir());
        log.info("Starting dataforge in {} mode", mode);
        log.info("Using config file: {}", configPath);

        StepRegistry registry = StepRegistries.defaults(StepServices.fromConfig(config));
        if (mode == Mode.steps) {
            registry.describe().forEach((name, description) -> System.out.println(name + "\t" + description));
            return EXIT_OK;
        }
        if (input == null) {
            log.error("--input is required in {} mode", mode);
            return EXIT_USAGE;
        }
        if (mode == Mode.clean && workflow == null) {
            log.error("--workflow is required in clean mode");
            return EXIT_USAGE;
        }

        Dataset dataset = new DatasetLoader().load(input);
        if (dataset.isEmpty()) {
            log.error("Input dataset is empty or could not be parsed: {}", input);
            return EXIT_RUN_FAILED;
        }

        ProgressListener progress = (percent, step, message) ->
                log.info("progress job={} percent={} step={} message=\"{}\"", job, percent, step, message);
        try {
            if (mode == Mode.clean) {
                List<StepConfig> steps;
                try {
                    steps = loadWorkflow(workflow);
                } catch (IOException | IllegalArgumentException e) {
                    log.error("Invalid workflow file {}: {}", workflow, e.getMessage());
                    return EXIT_USAGE;
                }
                runClean(registry, dataset, steps, job, output, progress);
            } else {
                FinetuneConfig settings;
                try {
                    settings = loadFinetuneConfig(finetuneConfig);
                } catch (IOException | IllegalArgumentException e) {
                    log.error("Invalid fine-tune config {}: {}", finetuneConfig, e.getMessage());
                    return EXIT_USAGE;
                }
                runFinetune(registry, config, dataset, settings, job, output, progress);
            }
        } catch (PipelineInputException e) {
            log.error("Run failed job={}: {}", job, e.getMessage());
            return EXIT_RUN_FAILED;
        }
        return EXIT_OK;
    }

    private void runClean(
            StepRegistry registry,
            Dataset dataset,
            List<StepConfig> steps,
            String job,
            Path output,
            ProgressListener progress) throws IOException {
        PipelineRunResult result = new PipelineRunner(registry).run(dataset, steps, job, progress);
        Files.createDirectories(output);
        Path processed = output.resolve(job + "_processed.jsonl");
        writeJsonLines(result.dataset(), processed);

        List<Map<String, Object>> stepReports = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            StepResult stepResult = result.stepResults().get(i);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("step", steps.get(i).step());
            entry.put("skipped", stepResult.isSkipped());
            entry.put("rows_before", stepResult.rowsBefore());
            entry.put("rows_after", stepResult.rowsAfter());
            entry.put("rows_removed", stepResult.rowsRemoved());
            entry.put("metadata", stepResult.metadata());
            entry.put("warnings", stepResult.warnings());
            stepReports.add(entry);
        }
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("job_id", job);
        report.put("total_rows_before", result.totalRowsBefore());
        report.put("total_rows_after", result.totalRowsAfter());
        report.put("total_rows_removed", result.totalRowsRemoved());
        report.put("pipeline_stats", result.pipelineStats());
        report.put("steps", stepReports);
        report.put("warnings", result.warnings());
        report.put("duration_seconds", result.durationSeconds());
        report.put("output_file", processed.getFileName().toString());
        jsonMapper.writerWithDefaultPrettyPrinter().writeValue(output.resolve(job + "_report.json").toFile(), report);
        log.info("Clean run finished job={} rowsBefore={} rowsAfter={} output={}",
                job, result.totalRowsBefore(), result.totalRowsAfter(), processed);
    }

    private void runFinetune(
            StepRegistry registry,
            AppConfig config,
            Dataset dataset,
            FinetuneConfig settings,
            String job,
            Path output,
            ProgressListener progress) throws IOException {
        FinetunePipelineRunner runner = new FinetunePipelineRunner(
                registry, new FinetuneExporter(jsonMapper), output, config.getFinetune());
        FinetunePipelineResult result = runner.run(dataset, settings, job, progress);

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("job_id", job);
        report.put("output_format", result.outputFormat().id());
        report.put("total_examples", result.totalExamples());
        report.put("train_examples", result.trainExamples());
        report.put("val_examples", result.valExamples());
        report.put("avg_tokens", result.avgTokens());
        report.put("estimated_training_time", result.estimatedTrainingTime());
        report.put("output_files", result.outputFiles());
        report.put("step_results", result.stepStats());
        report.put("warnings", result.warnings());
        jsonMapper.writerWithDefaultPrettyPrinter()
                .writeValue(output.resolve(job + "_finetune_report.json").toFile(), report);
        log.info("Fine-tune run finished job={} train={} val={} estimate=\"{}\"",
                job, result.trainExamples(), result.valExamples(), result.estimatedTrainingTime());
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        return yamlMapper.readValue(config.toFile(), AppConfig.class);
    }

    List<StepConfig> loadWorkflow(Path path) throws IOException {
        JsonNode root = yamlMapper.readTree(path.toFile());
        JsonNode steps = root != null && root.isObject() ? root.get("steps") : root;
        if (steps == null || !steps.isArray()) {
            throw new IllegalArgumentException("workflow must be a list of {step, config} entries");
        }
        return yamlMapper.convertValue(steps, new TypeReference<List<StepConfig>>() {
        });
    }

    private FinetuneConfig loadFinetuneConfig(Path path) throws IOException {
        if (path == null) {
            return FinetuneConfig.defaults();
        }
        return yamlMapper.readValue(path.toFile(), FinetuneConfig.class);
    }

    private void writeJsonLines(Dataset dataset, Path target) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (Map<String, Object> row : dataset.rows()) {
                writer.write(jsonMapper.writeValueAsString(row));
                writer.newLine();
            }
        }
    }
}
