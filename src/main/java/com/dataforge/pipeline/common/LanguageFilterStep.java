package com.dataforge.pipeline.common;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;
import com.dataforge.language.LanguageDetector;
import com.dataforge.language.LanguageGuess;
import com.dataforge.pipeline.ConfigReader;
import com.dataforge.pipeline.PipelineStep;
import com.dataforge.pipeline.StepResult;

public class LanguageFilterStep implements PipelineStep {
    public static final String NAME = "language_filter";
    static final int MIN_DETECTABLE_LENGTH = 20;
    private static final Logger log = LoggerFactory.getLogger(LanguageFilterStep.class);

    private final LanguageDetector detector;

    public LanguageFilterStep(LanguageDetector detector) {
        this.detector = detector;
    }

    enum Action {
        TAG_ONLY,
        FILTER_KEEP,
        FILTER_REMOVE
    }

    record Settings(Action action, Set<String> languages, double minConfidence, String textColumn, String tagColumn) {
        static Settings from(Map<String, Object> config) {
            ConfigReader reader = ConfigReader.of(NAME, config);
            return new Settings(
                    reader.choice("action", Action.TAG_ONLY, Action.class),
                    Set.copyOf(reader.stringList("languages", List.of("en"))),
                    reader.decimal("min_confidence", 0.0),
                    reader.string("text_column", "auto"),
                    reader.string("tag_column_name", "language"));
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Detect language per row and filter/tag based on language";
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

        String textColumn = settings.textColumn();
        if ("auto".equals(textColumn)) {
            textColumn = longestTextColumn(dataset);
            if (textColumn == null) {
                warnings.add("No text columns found for language detection.");
                return StepResult.unchanged(dataset, Map.of("language_distribution", Map.of()), warnings);
            }
            log.info("language.column.auto column={}", textColumn);
        }
        if (!dataset.hasColumn(textColumn)) {
            warnings.add("Column '" + textColumn + "' not found.");
            return StepResult.unchanged(dataset, Map.of("language_distribution", Map.of()), warnings);
        }
        if (!detector.isAvailable()) {
            warnings.add("Language profiles not available, all rows tagged 'unknown'.");
        }

        List<Object> languages = new ArrayList<>(rowsBefore);
        List<Object> confidences = new ArrayList<>(rowsBefore);
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (int row = 0; row < rowsBefore; row++) {
            LanguageGuess guess = detect(dataset.text(row, textColumn), settings.minConfidence());
            languages.add(guess.language());
            confidences.add(guess.confidence());
            distribution.merge(guess.language(), 1, Integer::sum);
        }

        String tagColumn = settings.tagColumn();
        Dataset tagged = dataset
                .withColumn(tagColumn, languages)
                .withColumn(tagColumn + "_confidence", confidences);
        Dataset result = tagged;
        if (settings.action() == Action.FILTER_KEEP) {
            result = tagged.filterRows(row -> settings.languages().contains(languages.get(row)));
        } else if (settings.action() == Action.FILTER_REMOVE) {
            result = tagged.filterRows(row -> !settings.languages().contains(languages.get(row)));
        }
        int rowsRemoved = rowsBefore - result.rowCount();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("language_distribution", distribution);
        metadata.put("rows_removed", rowsRemoved);
        metadata.put("action", settings.action().name().toLowerCase(Locale.ROOT));
        metadata.put("text_column_used", textColumn);
        return StepResult.of(rowsBefore, result, metadata, warnings);
    }

    private LanguageGuess detect(String text, double minConfidence) {
        if (text.strip().length() < MIN_DETECTABLE_LENGTH) {
            return LanguageGuess.unknown();
        }
        LanguageGuess guess = detector.detect(text);
        if (guess.confidence() < minConfidence) {
            return new LanguageGuess(LanguageGuess.UNKNOWN, guess.confidence());
        }
        return guess;
    }

    static String longestTextColumn(Dataset dataset) {
        String best = null;
        double bestAverage = -1.0;
        for (String column : dataset.textColumns()) {
            double total = 0;
            for (int row = 0; row < dataset.rowCount(); row++) {
                total += dataset.text(row, column).length();
            }
            double average = dataset.rowCount() == 0 ? 0 : total / dataset.rowCount();
            if (average > bestAverage) {
                bestAverage = average;
                best = column;
            }
        }
        return best;
    }
}
