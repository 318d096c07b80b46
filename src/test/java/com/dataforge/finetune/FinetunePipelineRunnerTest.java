package com.dataforge.finetune;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.dataforge.dataset.Dataset;
import com.dataforge.pipeline.PipelineInputException;
import com.dataforge.runtime.AppConfig;
import com.dataforge.runtime.StepRegistries;
import com.dataforge.runtime.StepServices;

class FinetunePipelineRunnerTest {

    private static final List<String> TOPICS = List.of(
            "rivers", "mountains", "forests", "deserts", "oceans", "glaciers", "volcanoes", "islands", "canyons",
            "prairies", "wetlands", "reefs", "caves", "lakes", "valleys", "tundra", "savannas", "estuaries",
            "plateaus", "lagoons");

    @TempDir
    Path tempDir;

    @Test
    void shouldCleanFormatSplitAndExport() throws Exception {
        FinetunePipelineRunner runner = runner();
        List<Integer> progress = new ArrayList<>();

        FinetunePipelineResult result = runner.run(alpaca(), FinetuneConfig.defaults(), "job",
                (percent, step, message) -> progress.add(percent));

        assertEquals(20, result.totalExamples());
        assertEquals(18, result.trainExamples());
        assertEquals(2, result.valExamples());
        assertEquals(OutputFormat.OPENAI, result.outputFormat());
        assertEquals(Map.of("train", "job_train.jsonl", "val", "job_val.jsonl", "config", "job_training_config.json"),
                result.outputFiles());
        assertTrue(Files.exists(tempDir.resolve("job_train.jsonl")));
        assertTrue(Files.exists(tempDir.resolve("job_val.jsonl")));
        assertTrue(Files.exists(tempDir.resolve("job_training_config.json")));
        assertEquals(18, Files.readAllLines(tempDir.resolve("job_train.jsonl")).size());
        assertTrue(result.avgTokens() > 0);
        assertEquals("< 6 mins", result.estimatedTrainingTime());
        assertEquals(100, progress.get(progress.size() - 1));
        for (int i = 1; i < progress.size(); i++) {
            assertTrue(progress.get(i) >= progress.get(i - 1), "progress went backwards: " + progress);
        }
        assertEquals(List.of("deduplication", "noise_removal", "pii_scrubbing", "quality_scorer",
                "finetune_formatter", "response_quality"),
                result.stepStats().stream().map(FinetunePipelineResult.StepStats::step).toList());
    }

    @Test
    void shouldStratifyValidationByBalancedCategory() throws Exception {
        Dataset dataset = alpaca();
        List<String> categories = new ArrayList<>();
        for (int i = 0; i < dataset.rowCount(); i++) {
            categories.add(i < 12 ? "geography" : "ecology");
        }
        FinetuneConfig config = FinetuneConfig.builder()
                .runBalancer(true)
                .balancerConfig(Map.of("target_column", "category"))
                .build();

        FinetunePipelineResult result = runner().run(dataset.withColumn("category", categories), config, "bal", null);

        assertEquals(16, result.totalExamples());
        assertEquals(2, result.valExamples());
        assertTrue(result.validation().column("category").containsAll(List.of("geography", "ecology")));
    }

    @Test
    void shouldKeepOneValidationRowForZeroSplit() throws Exception {
        FinetuneConfig config = FinetuneConfig.builder()
                .valSplit(0.0)
                .outputFormat(OutputFormat.ALPACA)
                .build();

        FinetunePipelineResult result = runner().run(alpaca(), config, "solo", null);

        assertEquals(19, result.trainExamples());
        assertEquals(1, result.valExamples());
        assertTrue(result.outputFile("val").isPresent());
        assertFalse(result.outputFile("missing").isPresent());
    }

    @Test
    void shouldFormatWithApplicationTokenizerWhenConfigNamesNone() throws Exception {
        AppConfig.FinetuneDefaults defaults = new AppConfig().getFinetune();
        defaults.setTokenizer("missing_encoding");
        FinetunePipelineRunner runner = new FinetunePipelineRunner(
                StepRegistries.defaults(StepServices.offline()), new FinetuneExporter(), tempDir, defaults);

        FinetunePipelineResult fallback = runner.run(alpaca(), FinetuneConfig.defaults(), "tok", null);
        FinetunePipelineResult explicit = runner.run(alpaca(),
                FinetuneConfig.builder().tokenizer(TokenCounter.DEFAULT_ENCODING).build(), "tok2", null);

        assertTrue(fallback.warnings().stream().anyMatch(w -> w.contains("Tokenizer missing_encoding not found")));
        assertTrue(explicit.warnings().stream().noneMatch(w -> w.contains("missing_encoding")));
    }

    @Test
    void shouldRejectEmptyDataset() {
        assertThrows(PipelineInputException.class,
                () -> runner().run(Dataset.empty(), FinetuneConfig.defaults(), "empty", null));
    }

    @Test
    void shouldEstimateTrainingTimeFromTokenThroughput() {
        FinetunePipelineRunner runner = runner();

        assertEquals("< 6 mins", runner.estimateTrainingTime(100, 50));
        assertEquals("~1.7 hours", runner.estimateTrainingTime(100000, 100));
    }

    private FinetunePipelineRunner runner() {
        return new FinetunePipelineRunner(
                StepRegistries.defaults(StepServices.offline()),
                new FinetuneExporter(),
                tempDir,
                new AppConfig().getFinetune());
    }

    private static Dataset alpaca() {
        List<String> instructions = new ArrayList<>();
        List<String> inputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        for (String topic : TOPICS) {
            instructions.add("Describe the main features of " + topic + " for students");
            inputs.add("");
            outputs.add("Scientists describe " + topic + " as distinctive landscapes shaped by climate, water and time.");
        }
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("instruction", instructions);
        columns.put("input", inputs);
        columns.put("output", outputs);
        return Dataset.fromColumns(columns);
    }
}
