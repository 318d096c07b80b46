package com.dataforge.pipeline.common;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;
import com.dataforge.pipeline.ConfigReader;
import com.dataforge.pipeline.PipelineStep;
import com.dataforge.pipeline.StepResult;

public class NoiseRemovalStep implements PipelineStep {
    public static final String NAME = "noise_removal";
    private static final Logger log = LoggerFactory.getLogger(NoiseRemovalStep.class);

    record Settings(
            List<String> columns,
            boolean fixEncoding,
            boolean stripHtml,
            boolean normalizeUnicode,
            boolean removeControlChars,
            boolean normalizeWhitespace,
            boolean stripUrls,
            List<String> customPatterns,
            int minTextLength,
            int maxTextLength) {

        static Settings from(Map<String, Object> config) {
            ConfigReader reader = ConfigReader.of(NAME, config);
            return new Settings(
                    reader.columns("columns", "all_text").orElse(List.of()),
                    reader.bool("fix_encoding", true),
                    reader.bool("strip_html", true),
                    reader.bool("normalize_unicode", true),
                    reader.bool("remove_control_chars", true),
                    reader.bool("normalize_whitespace", true),
                    reader.bool("strip_urls", false),
                    reader.stringList("custom_patterns", List.of()),
                    reader.integer("min_text_length", 0),
                    reader.integer("max_text_length", 0));
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Clean text: fix encoding, strip HTML, normalize whitespace and unicode";
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

        List<String> textColumns = settings.columns().isEmpty()
                ? dataset.textColumns()
                : settings.columns().stream().filter(dataset::hasColumn).toList();
        if (textColumns.isEmpty()) {
            warnings.add("No text columns found for noise removal.");
            return StepResult.unchanged(dataset, Map.of(), warnings);
        }

        TextCleaner cleaner = new TextCleaner(settings, compilePatterns(settings.customPatterns(), warnings));
        int encodingFixes = 0;
        int htmlStripped = 0;
        long charsCleaned = 0;
        Dataset current = dataset;
        for (String column : textColumns) {
            List<Object> values = current.column(column);
            List<Object> cleanedValues = new ArrayList<>(values.size());
            for (Object value : values) {
                if (!(value instanceof String text)) {
                    cleanedValues.add(value);
                    continue;
                }
                TextCleaner.Cleaned cleaned = cleaner.clean(text);
                encodingFixes += cleaned.encodingFixed() ? 1 : 0;
                htmlStripped += cleaned.htmlStripped() ? 1 : 0;
                charsCleaned += Math.abs(text.length() - cleaned.text().length());
                cleanedValues.add(cleaned.text());
            }
            current = current.withColumn(column, cleanedValues);
        }

        int beforeLengthFilter = current.rowCount();
        if (settings.minTextLength() > 0 || settings.maxTextLength() > 0) {
            String primary = textColumns.get(0);
            Dataset cleanedDataset = current;
            current = current.filterRows(row -> withinLength(cleanedDataset.text(row, primary).length(), settings));
        }
        int removedByLength = beforeLengthFilter - current.rowCount();
        double averageCleaned = rowsBefore > 0 ? (double) charsCleaned / rowsBefore : 0.0;

        log.info("noise.cleaned columns={} encodingFixes={} htmlStripped={} removedByLength={}",
                textColumns.size(), encodingFixes, htmlStripped, removedByLength);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("encoding_fixes", encodingFixes);
        metadata.put("html_stripped", htmlStripped);
        metadata.put("rows_removed_by_length", removedByLength);
        metadata.put("chars_cleaned_per_row_avg", Math.round(averageCleaned * 100.0) / 100.0);
        return StepResult.of(rowsBefore, current, metadata, warnings);
    }

    private static boolean withinLength(int length, Settings settings) {
        if (settings.minTextLength() > 0 && length < settings.minTextLength()) {
            return false;
        }
        return settings.maxTextLength() <= 0 || length <= settings.maxTextLength();
    }

    private static List<Pattern> compilePatterns(List<String> patterns, List<String> warnings) {
        List<Pattern> compiled = new ArrayList<>();
        for (String pattern : patterns) {
            try {
                compiled.add(Pattern.compile(pattern));
            } catch (PatternSyntaxException e) {
                warnings.add("Invalid regex pattern '" + pattern + "': " + e.getDescription());
            }
        }
        return compiled;
    }
}
