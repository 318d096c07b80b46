package com.dataforge.pipeline.common;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;
import com.dataforge.pii.PiiDetector;
import com.dataforge.pii.PiiMatch;
import com.dataforge.pii.RegexPiiDetector;
import com.dataforge.pipeline.ConfigReader;
import com.dataforge.pipeline.PipelineStep;
import com.dataforge.pipeline.StepResult;

public class PiiScrubberStep implements PipelineStep {
    public static final String NAME = "pii_scrubbing";
    public static final String FLAG_COLUMN = "pii_detected";
    public static final String ENTITIES_COLUMN = "pii_entities";
    private static final String ENTITY_TYPE_TOKEN = "<ENTITY_TYPE>";
    private static final Logger log = LoggerFactory.getLogger(PiiScrubberStep.class);

    private final PiiDetector nerDetector;
    private final PiiDetector regexDetector;

    public PiiScrubberStep(PiiDetector nerDetector) {
        this(nerDetector, new RegexPiiDetector());
    }

    PiiScrubberStep(PiiDetector nerDetector, PiiDetector regexDetector) {
        this.nerDetector = nerDetector;
        this.regexDetector = regexDetector;
    }

    enum Action {
        REDACT,
        REMOVE_ROW,
        FLAG
    }

    record Settings(Action action, List<String> entities, String redactWith, List<String> columns) {
        static Settings from(Map<String, Object> config) {
            ConfigReader reader = ConfigReader.of(NAME, config);
            List<String> entities = reader.stringList("entities", List.of("ALL")).stream()
                    .map(entity -> entity.toUpperCase(Locale.ROOT))
                    .toList();
            return new Settings(
                    reader.choice("action", Action.REDACT, Action.class),
                    entities,
                    reader.string("redact_with", "[REDACTED]"),
                    reader.columns("columns", "all_text").orElse(List.of()));
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Detect and redact, remove or flag personally identifiable information";
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
            warnings.add("No text columns found for PII scanning.");
            return StepResult.unchanged(dataset, Map.of("rows_with_pii", 0), warnings);
        }

        boolean useNer = nerDetector.isAvailable();
        if (!useNer) {
            warnings.add("NER models not available, using regex patterns only.");
        }
        Set<String> entities = resolveEntities(settings.entities(), useNer);

        Map<String, List<Object>> rewritten = new LinkedHashMap<>();
        textColumns.forEach(column -> rewritten.put(column, new ArrayList<>(dataset.column(column))));
        List<Object> flags = new ArrayList<>(rowsBefore);
        List<Object> entityLists = new ArrayList<>(rowsBefore);
        Map<String, Integer> counts = new LinkedHashMap<>();
        int rowsWithPii = 0;
        int totalInstances = 0;

        for (int row = 0; row < rowsBefore; row++) {
            Set<String> rowEntities = new LinkedHashSet<>();
            for (String column : textColumns) {
                Object value = dataset.value(row, column);
                if (!(value instanceof String text) || text.isEmpty()) {
                    continue;
                }
                List<PiiMatch> matches = resolveOverlaps(detect(text, entities, useNer));
                if (matches.isEmpty()) {
                    continue;
                }
                for (PiiMatch match : matches) {
                    counts.merge(match.entityType(), 1, Integer::sum);
                    rowEntities.add(match.entityType());
                }
                totalInstances += matches.size();
                if (settings.action() == Action.REDACT) {
                    rewritten.get(column).set(row, redact(text, matches, settings.redactWith()));
                }
            }
            if (!rowEntities.isEmpty()) {
                rowsWithPii++;
            }
            flags.add(!rowEntities.isEmpty());
            entityLists.add(String.join(",", rowEntities));
        }

        Dataset result = dataset;
        if (settings.action() == Action.REDACT) {
            for (Map.Entry<String, List<Object>> entry : rewritten.entrySet()) {
                result = result.withColumn(entry.getKey(), entry.getValue());
            }
        } else if (settings.action() == Action.REMOVE_ROW) {
            result = result.filterRows(row -> !Boolean.TRUE.equals(flags.get(row)));
        } else {
            result = result.withColumn(FLAG_COLUMN, flags).withColumn(ENTITIES_COLUMN, entityLists);
        }

        log.info("pii.scanned columns={} rowsWithPii={} instances={} action={} ner={}",
                textColumns.size(), rowsWithPii, totalInstances, settings.action(), useNer);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rows_with_pii", rowsWithPii);
        metadata.put("total_pii_instances", totalInstances);
        metadata.put("entities_found", counts);
        metadata.put("action_taken", settings.action().name().toLowerCase(Locale.ROOT));
        metadata.put("columns_scanned", textColumns);
        return StepResult.of(rowsBefore, result, metadata, warnings);
    }

    private Set<String> resolveEntities(List<String> requested, boolean useNer) {
        if (!requested.contains("ALL")) {
            return new LinkedHashSet<>(requested);
        }
        Set<String> all = new LinkedHashSet<>(regexDetector.supportedEntities());
        if (useNer) {
            all.addAll(nerDetector.supportedEntities());
        }
        return all;
    }

    private List<PiiMatch> detect(String text, Set<String> entities, boolean useNer) {
        List<PiiMatch> matches = new ArrayList<>();
        if (useNer) {
            matches.addAll(nerDetector.detect(text, entities));
        }
        matches.addAll(regexDetector.detect(text, entities));
        return matches;
    }

    static List<PiiMatch> resolveOverlaps(List<PiiMatch> matches) {
        List<PiiMatch> ordered = new ArrayList<>(matches);
        ordered.sort(Comparator.comparingInt(PiiMatch::length).reversed().thenComparingInt(PiiMatch::start));
        List<PiiMatch> kept = new ArrayList<>();
        for (PiiMatch candidate : ordered) {
            if (kept.stream().noneMatch(candidate::overlaps)) {
                kept.add(candidate);
            }
        }
        kept.sort(Comparator.comparingInt(PiiMatch::start));
        return kept;
    }

    static String redact(String text, List<PiiMatch> matches, String redactWith) {
        StringBuilder builder = new StringBuilder(text);
        for (int i = matches.size() - 1; i >= 0; i--) {
            PiiMatch match = matches.get(i);
            String replacement = ENTITY_TYPE_TOKEN.equals(redactWith) ? "<" + match.entityType() + ">" : redactWith;
            builder.replace(match.start(), match.end(), replacement);
        }
        return builder.toString();
    }
}
