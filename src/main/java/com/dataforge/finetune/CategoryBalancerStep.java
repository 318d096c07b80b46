package com.dataforge.finetune;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;
import com.dataforge.pipeline.ConfigReader;
import com.dataforge.pipeline.PipelineStep;
import com.dataforge.pipeline.StepConfigException;
import com.dataforge.pipeline.StepResult;

/**
 * Rebalances categories by undersampling to the minority size or oversampling with replacement up to the majority
 * size. Rows whose category cell is empty are carried through untouched.
 */
public class CategoryBalancerStep implements PipelineStep {
    public static final String NAME = "category_balancer";
    public static final String CATEGORY_COLUMN_KEY = "category_column";
    private static final Set<String> EXCLUDED_FROM_DETECTION = Set.of(
            FinetuneFormatterStep.NORM_INSTRUCTION,
            FinetuneFormatterStep.NORM_INPUT,
            FinetuneFormatterStep.NORM_OUTPUT,
            FinetuneFormatterStep.FORMATTED_TEXT);
    private static final Logger log = LoggerFactory.getLogger(CategoryBalancerStep.class);

    enum Method {
        UNDERSAMPLE,
        OVERSAMPLE,
        AUGMENT
    }

    record Settings(
            Method method,
            String targetColumn,
            Integer maxPerCategory,
            Integer minPerCategory,
            double balanceRatio,
            int maxAutoCategories,
            long seed) {

        static Settings from(Map<String, Object> config) {
            ConfigReader reader = ConfigReader.of(NAME, config);
            double ratio = reader.decimal("balance_ratio", 1.0);
            if (ratio <= 0) {
                throw new StepConfigException(NAME, "balance_ratio must be positive");
            }
            return new Settings(
                    reader.choice("method", Method.UNDERSAMPLE, Method.class),
                    reader.string("target_column", "auto"),
                    positiveOrNull(reader.optionalInteger("max_per_category")),
                    positiveOrNull(reader.optionalInteger("min_per_category")),
                    ratio,
                    reader.integer("max_auto_categories", 50),
                    reader.integer("seed", 42));
        }

        private static Integer positiveOrNull(Integer value) {
            return value == null || value <= 0 ? null : value;
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Balance dataset categories to prevent model bias";
    }

    @Override
    public void validateConfig(Map<String, Object> config) {
        Settings.from(config);
    }

    @Override
    public StepResult run(Dataset dataset, Map<String, Object> config) {
        Settings settings = Settings.from(config);
        if (dataset.isEmpty()) {
            return StepResult.unchanged(dataset, Map.of(), List.of());
        }
        int rowsBefore = dataset.rowCount();
        List<String> warnings = new ArrayList<>();

        String column = settings.targetColumn();
        if ("auto".equals(column)) {
            column = detectCategoryColumn(dataset, settings.maxAutoCategories());
            if (column == null) {
                warnings.add("Could not auto-detect a category column. Balancer skipped.");
                return StepResult.unchanged(dataset, Map.of("status", "skipped_no_column"), warnings);
            }
            log.info("finetune.balancer.column.auto column={}", column);
        }
        if (!dataset.hasColumn(column)) {
            warnings.add("Target column '" + column + "' not found. Balancer skipped.");
            return StepResult.unchanged(dataset, Map.of("status", "skipped_missing_column"), warnings);
        }

        Map<String, List<Integer>> groups = new TreeMap<>();
        List<Integer> uncategorized = new ArrayList<>();
        for (int row = 0; row < rowsBefore; row++) {
            Object value = dataset.value(row, column);
            if (value == null) {
                uncategorized.add(row);
            } else {
                groups.computeIfAbsent(String.valueOf(value), unused -> new ArrayList<>()).add(row);
            }
        }
        if (groups.isEmpty()) {
            return StepResult.unchanged(dataset, Map.of("status", "skipped_empty_col"), warnings);
        }

        Method method = settings.method();
        if (method == Method.AUGMENT) {
            warnings.add("'augment' method requires async AI generation. Falling back to 'oversample'.");
            method = Method.OVERSAMPLE;
        }

        Random random = new Random(settings.seed());
        List<Integer> selected = new ArrayList<>(uncategorized);
        int target = method == Method.UNDERSAMPLE
                ? undersampleTarget(groups, settings)
                : oversampleTarget(groups, settings);
        for (List<Integer> members : groups.values()) {
            if (members.size() > target) {
                selected.addAll(sampleWithoutReplacement(members, target, random));
            } else if (method == Method.OVERSAMPLE && members.size() < target) {
                selected.addAll(members);
                for (int i = members.size(); i < target; i++) {
                    selected.add(members.get(random.nextInt(members.size())));
                }
            } else {
                selected.addAll(members);
            }
        }
        Collections.shuffle(selected, random);
        Dataset balanced = dataset.selectRows(selected);

        log.info("finetune.balancer.completed column={} method={} target={} rowsBefore={} rowsAfter={}",
                column, method, target, rowsBefore, balanced.rowCount());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(CATEGORY_COLUMN_KEY, column);
        metadata.put("distribution_before", distribution(dataset, column));
        metadata.put("distribution_after", distribution(balanced, column));
        metadata.put("method", method.name().toLowerCase(Locale.ROOT));
        metadata.put("synthetic_examples_added", 0);
        return StepResult.of(rowsBefore, balanced, metadata, warnings);
    }

    static String detectCategoryColumn(Dataset dataset, int maxCategories) {
        String best = null;
        long lowest = Long.MAX_VALUE;
        for (String column : dataset.textColumns()) {
            if (EXCLUDED_FROM_DETECTION.contains(column)) {
                continue;
            }
            long unique = dataset.column(column).stream().filter(value -> value != null).distinct().count();
            if (unique > 1 && unique <= maxCategories && unique < lowest) {
                lowest = unique;
                best = column;
            }
        }
        return best;
    }

    private static int undersampleTarget(Map<String, List<Integer>> groups, Settings settings) {
        int target = groups.values().stream().mapToInt(List::size).min().orElse(0);
        if (settings.maxPerCategory() != null && settings.maxPerCategory() < target) {
            target = settings.maxPerCategory();
        }
        return Math.max(1, (int) (target / settings.balanceRatio()));
    }

    private static int oversampleTarget(Map<String, List<Integer>> groups, Settings settings) {
        int target = groups.values().stream().mapToInt(List::size).max().orElse(0);
        if (settings.minPerCategory() != null && target < settings.minPerCategory()) {
            target = settings.minPerCategory();
        }
        if (settings.maxPerCategory() != null && target > settings.maxPerCategory()) {
            target = settings.maxPerCategory();
        }
        return target;
    }

    private static List<Integer> sampleWithoutReplacement(List<Integer> members, int count, Random random) {
        List<Integer> shuffled = new ArrayList<>(members);
        Collections.shuffle(shuffled, random);
        return shuffled.subList(0, count);
    }

    static Map<String, Integer> distribution(Dataset dataset, String column) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Object value : dataset.column(column)) {
            if (value != null) {
                counts.merge(String.valueOf(value), 1, Integer::sum);
            }
        }
        Map<String, Integer> ordered = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(entry -> ordered.put(entry.getKey(), entry.getValue()));
        return ordered;
    }
}
