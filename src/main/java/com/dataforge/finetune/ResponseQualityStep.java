package com.dataforge.finetune;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;
import com.dataforge.pipeline.ConfigReader;
import com.dataforge.pipeline.PipelineStep;
import com.dataforge.pipeline.StepResult;

public class ResponseQualityStep implements PipelineStep {
    public static final String NAME = "response_quality";
    public static final String SCORE_COLUMN = "_response_quality_score";
    public static final String REASONS_COLUMN = "_response_quality_reasons";
    static final double PASSING_SCORE = 6.0;
    private static final String TERMINAL_CHARACTERS = ".!?\"'”’]}>";
    private static final Logger log = LoggerFactory.getLogger(ResponseQualityStep.class);

    enum Action {
        FILTER,
        SCORE_ONLY
    }

    record Settings(
            int minResponseWords,
            int maxResponseWords,
            int minInstructionWords,
            boolean checkCompleteness,
            boolean filterRefusals,
            List<String> refusalPhrases,
            Action action) {

        static Settings from(Map<String, Object> config) {
            ConfigReader reader = ConfigReader.of(NAME, config);
            return new Settings(
                    reader.integer("min_response_length", 10),
                    reader.integer("max_response_length", 2000),
                    reader.integer("min_instruction_length", 3),
                    reader.bool("check_response_completeness", true),
                    reader.bool("filter_refusals", true),
                    reader.stringList("refusal_phrases", RefusalDetector.DEFAULT_PHRASES),
                    reader.choice("action", Action.FILTER, Action.class));
        }
    }

    record Evaluation(double score, List<String> reasons) {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Filter low-quality, incomplete or refusal responses from instruction datasets";
    }

    @Override
    public void validateConfig(Map<String, Object> config) {
        Settings.from(config);
    }

    @Override
    public StepResult run(Dataset dataset, Map<String, Object> config) {
        Settings settings = Settings.from(config);
        int rowsBefore = dataset.rowCount();
        List<String> warnings = new ArrayList<>();
        List<String> columns = dataset.columnNames();
        if (columns.isEmpty()) {
            warnings.add("Could not find instruction/output columns. Skipping Response Quality.");
            return StepResult.unchanged(dataset, Map.of(), warnings);
        }
        String instructionColumn = dataset.hasColumn(FinetuneFormatterStep.NORM_INSTRUCTION)
                ? FinetuneFormatterStep.NORM_INSTRUCTION
                : columns.get(0);
        String outputColumn = dataset.hasColumn(FinetuneFormatterStep.NORM_OUTPUT)
                ? FinetuneFormatterStep.NORM_OUTPUT
                : columns.get(columns.size() - 1);

        RefusalDetector refusals = new RefusalDetector(settings.refusalPhrases());
        List<Double> scores = new ArrayList<>(rowsBefore);
        List<String> reasons = new ArrayList<>(rowsBefore);
        for (int row = 0; row < rowsBefore; row++) {
            Evaluation evaluation = evaluate(
                    dataset.text(row, instructionColumn), dataset.text(row, outputColumn), settings, refusals);
            scores.add(evaluation.score());
            reasons.add(String.join(",", evaluation.reasons()));
        }

        Dataset result;
        if (settings.action() == Action.FILTER) {
            result = dataset.filterRows(row -> scores.get(row) >= PASSING_SCORE);
        } else {
            result = dataset.withColumn(SCORE_COLUMN, scores).withColumn(REASONS_COLUMN, reasons);
        }
        int filtered = rowsBefore - result.rowCount();
        double average = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        log.info("finetune.response_quality rows={} filtered={} avgScore={}", rowsBefore, filtered, average);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("avg_quality_score", Math.round(average * 100.0) / 100.0);
        metadata.put("total_filtered", filtered);
        return StepResult.of(rowsBefore, result, metadata, warnings);
    }

    static Evaluation evaluate(String instruction, String response, Settings settings, RefusalDetector refusals) {
        double score = 10.0;
        List<String> reasons = new ArrayList<>();
        int instructionWords = wordCount(instruction);
        int responseWords = wordCount(response);
        if (instructionWords < settings.minInstructionWords()) {
            score -= 5.0;
            reasons.add("instruction_too_short");
        }
        if (responseWords < settings.minResponseWords()) {
            score -= 5.0;
            reasons.add("response_too_short");
        }
        if (responseWords > settings.maxResponseWords()) {
            score -= 2.0;
            reasons.add("response_too_long");
        }
        if (settings.filterRefusals() && refusals.isRefusal(response)) {
            score -= 8.0;
            reasons.add("refusal_detected");
        }
        String trimmed = response.strip();
        if (settings.checkCompleteness() && !trimmed.isEmpty()
                && TERMINAL_CHARACTERS.indexOf(trimmed.charAt(trimmed.length() - 1)) < 0) {
            score -= 3.0;
            reasons.add("incomplete_response");
        }
        return new Evaluation(Math.max(0.0, score), reasons);
    }

    private static int wordCount(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
