package com.dataforge.pipeline.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;
import com.dataforge.pipeline.ConfigReader;
import com.dataforge.pipeline.PipelineStep;
import com.dataforge.pipeline.StepResult;
import com.dataforge.scoring.AiScore;
import com.dataforge.scoring.AiScoringService;
import com.dataforge.scoring.BatchedAiScorer;

public class QualityScorerStep implements PipelineStep {
    public static final String NAME = "quality_scorer";
    public static final String FLAG_COLUMN = "quality_flag";
    static final int AI_TEXT_LIMIT = 2000;
    private static final Logger log = LoggerFactory.getLogger(QualityScorerStep.class);

    private final AiScoringService scoringService;
    private final HeuristicQualityScorer heuristic = new HeuristicQualityScorer();

    public QualityScorerStep(AiScoringService scoringService) {
        this.scoringService = scoringService;
    }

    enum Method {
        HEURISTIC,
        AI,
        BOTH
    }

    enum Action {
        SCORE_ONLY,
        FILTER,
        FLAG
    }

    record Settings(
            Method method,
            Action action,
            double threshold,
            String scoreColumn,
            String reasonColumn,
            List<String> textColumns,
            int aiBatchSize,
            long aiBatchDelayMs,
            int aiMaxRetries,
            int aiConcurrency) {

        static Settings from(Map<String, Object> config) {
            ConfigReader reader = ConfigReader.of(NAME, config);
            long delayMs = reader.has("ai_batch_delay_ms")
                    ? reader.integer("ai_batch_delay_ms", 500)
                    : Math.round(reader.decimal("ai_batch_delay", 0.5) * 1000);
            return new Settings(
                    reader.choice("method", Method.HEURISTIC, Method.class),
                    reader.choice("action", Action.SCORE_ONLY, Action.class),
                    reader.decimal("threshold", 0.0),
                    reader.string("score_column_name", "quality_score"),
                    reader.string("reason_column_name", "quality_reason"),
                    reader.columns("text_columns", "auto").orElse(List.of()),
                    reader.integer("ai_batch_size", 20),
                    delayMs,
                    reader.integer("ai_max_retries", 3),
                    reader.integer("ai_concurrency", 2));
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Score each row 0-10 for quality using heuristics and optional AI";
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

        List<String> textColumns = settings.textColumns().isEmpty()
                ? dataset.textColumns()
                : settings.textColumns().stream().filter(dataset::hasColumn).toList();
        if (textColumns.isEmpty()) {
            warnings.add("No text columns found for quality scoring.");
            Dataset scored = dataset
                    .withColumn(settings.scoreColumn(), Collections.nCopies(rowsBefore, 5.0))
                    .withColumn(settings.reasonColumn(), Collections.nCopies(rowsBefore, "No text columns"));
            return StepResult.unchanged(scored, Map.of(), warnings);
        }

        List<String> texts = new ArrayList<>(rowsBefore);
        for (int row = 0; row < rowsBefore; row++) {
            texts.add(joinText(dataset, row, textColumns));
        }

        List<Double> scores = new ArrayList<>(rowsBefore);
        List<String> reasons = new ArrayList<>(rowsBefore);
        String methodUsed = settings.method().name().toLowerCase(Locale.ROOT);
        if (settings.method() != Method.AI) {
            for (String text : texts) {
                HeuristicQualityScorer.Score score = heuristic.score(text);
                scores.add(score.score());
                reasons.add(score.reason());
            }
        }
        if (settings.method() != Method.HEURISTIC) {
            if (scoringService.isAvailable()) {
                List<AiScore> aiScores = scoreWithAi(texts, settings, warnings);
                mergeAiScores(settings.method(), aiScores, scores, reasons);
            } else {
                warnings.add("AI scoring service not configured, using heuristic scores only.");
                methodUsed = "heuristic (fallback)";
                if (settings.method() == Method.AI) {
                    for (String text : texts) {
                        HeuristicQualityScorer.Score score = heuristic.score(text);
                        scores.add(score.score());
                        reasons.add(score.reason());
                    }
                }
            }
        }

        Dataset scored = dataset
                .withColumn(settings.scoreColumn(), scores)
                .withColumn(settings.reasonColumn(), reasons);
        int rowsFiltered = 0;
        if (settings.threshold() > 0 && settings.action() == Action.FILTER) {
            scored = scored.filterRows(row -> scores.get(row) >= settings.threshold());
            rowsFiltered = rowsBefore - scored.rowCount();
        } else if (settings.threshold() > 0 && settings.action() == Action.FLAG) {
            List<Object> flags = new ArrayList<>(rowsBefore);
            scores.forEach(score -> flags.add(score < settings.threshold()));
            scored = scored.withColumn(FLAG_COLUMN, flags);
        }

        log.info("quality.scored rows={} method={} rowsFiltered={}", rowsBefore, methodUsed, rowsFiltered);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("score_distribution", distribution(scores));
        metadata.put("mean_score", round(scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0)));
        metadata.put("median_score", round(median(scores)));
        metadata.put("rows_filtered", rowsFiltered);
        metadata.put("method_used", methodUsed);
        return StepResult.of(rowsBefore, scored, metadata, warnings);
    }

    private List<AiScore> scoreWithAi(List<String> texts, Settings settings, List<String> warnings) {
        List<String> truncated = texts.stream()
                .map(text -> text.length() > AI_TEXT_LIMIT ? text.substring(0, AI_TEXT_LIMIT) : text)
                .toList();
        BatchedAiScorer scorer = new BatchedAiScorer(
                scoringService,
                settings.aiBatchSize(),
                settings.aiBatchDelayMs(),
                settings.aiMaxRetries(),
                settings.aiConcurrency());
        BatchedAiScorer.Outcome outcome = scorer.score(truncated, text -> {
            HeuristicQualityScorer.Score score = heuristic.score(text);
            return new AiScore(score.score(), score.reason());
        });
        warnings.addAll(outcome.warnings());
        return outcome.scores();
    }

    private static void mergeAiScores(Method method, List<AiScore> aiScores, List<Double> scores, List<String> reasons) {
        if (method == Method.AI) {
            aiScores.forEach(score -> {
                scores.add(score.score());
                reasons.add(score.reason());
            });
            return;
        }
        for (int i = 0; i < scores.size(); i++) {
            AiScore ai = aiScores.get(i);
            scores.set(i, round((scores.get(i) + ai.score()) / 2));
            reasons.set(i, "H: " + reasons.get(i) + " | AI: " + ai.reason());
        }
    }

    private static String joinText(Dataset dataset, int row, List<String> columns) {
        List<String> parts = new ArrayList<>(columns.size());
        for (String column : columns) {
            Object value = dataset.value(row, column);
            if (value != null) {
                parts.add(String.valueOf(value));
            }
        }
        return String.join(" ", parts);
    }

    static Map<String, Integer> distribution(List<Double> scores) {
        Map<String, Integer> buckets = new LinkedHashMap<>();
        for (String bucket : List.of("0-2", "2-4", "4-6", "6-8", "8-10")) {
            buckets.put(bucket, 0);
        }
        for (double score : scores) {
            String bucket = score < 2 ? "0-2" : score < 4 ? "2-4" : score < 6 ? "4-6" : score < 8 ? "6-8" : "8-10";
            buckets.merge(bucket, 1, Integer::sum);
        }
        return buckets;
    }

    private static double median(List<Double> scores) {
        if (scores.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(scores);
        Collections.sort(sorted);
        return sorted.get(sorted.size() / 2);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
