package com.dataforge.pipeline.common;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;
import com.dataforge.embedding.EmbeddingService;
import com.dataforge.embedding.NearestNeighborIndex;
import com.dataforge.pipeline.ConfigReader;
import com.dataforge.pipeline.PipelineStep;
import com.dataforge.pipeline.StepResult;

public class DeduplicationStep implements PipelineStep {
    public static final String NAME = "deduplication";
    private static final Logger log = LoggerFactory.getLogger(DeduplicationStep.class);

    private final EmbeddingService embeddingService;

    public DeduplicationStep(EmbeddingService embeddingService) {
        this.embeddingService = embeddingService;
    }

    enum Method {
        EXACT,
        SEMANTIC,
        BOTH
    }

    enum Keep {
        FIRST,
        LAST
    }

    record Settings(Method method, List<String> columns, Keep keep, double semanticThreshold, int semanticTopK) {
        static Settings from(Map<String, Object> config) {
            ConfigReader reader = ConfigReader.of(NAME, config);
            return new Settings(
                    reader.choice("method", Method.EXACT, Method.class),
                    reader.columns("columns", "all").orElse(List.of()),
                    reader.choice("keep", Keep.FIRST, Keep.class),
                    reader.decimal("semantic_threshold", 0.95),
                    Math.max(2, reader.integer("semantic_top_k", 10)));
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Remove duplicate rows using exact hash matching or semantic similarity";
    }

    @Override
    public void validateConfig(Map<String, Object> config) {
        Settings settings = Settings.from(config);
        if (settings.method() != Method.EXACT && !embeddingService.isAvailable()) {
            log.warn("dedup.semantic.unavailable method={} fallback=exact", settings.method());
        }
    }

    @Override
    public StepResult run(Dataset dataset, Map<String, Object> config) {
        Settings settings = Settings.from(config);
        int rowsBefore = dataset.rowCount();
        List<String> warnings = new ArrayList<>();

        List<String> columns = resolveColumns(dataset, settings.columns(), warnings);
        boolean semanticAvailable = embeddingService.isAvailable();
        Dataset current = dataset;
        int exactRemoved = 0;
        int semanticRemoved = 0;
        String methodUsed = settings.method().name().toLowerCase(Locale.ROOT);

        if (settings.method() != Method.SEMANTIC) {
            Dataset deduplicated = exactDeduplicate(current, columns, settings.keep());
            exactRemoved = current.rowCount() - deduplicated.rowCount();
            current = deduplicated;
            log.info("dedup.exact removed={} columns={}", exactRemoved, columns.size());
        }

        if (settings.method() != Method.EXACT) {
            Optional<Dataset> semantic = Optional.empty();
            if (semanticAvailable) {
                semantic = semanticDeduplicate(current, columns, settings, warnings);
            } else {
                warnings.add("Semantic embedding service unavailable. Falling back to exact dedup only.");
            }
            if (semantic.isPresent()) {
                semanticRemoved = current.rowCount() - semantic.get().rowCount();
                current = semantic.get();
                log.info("dedup.semantic removed={} threshold={} embedding={}",
                        semanticRemoved, settings.semanticThreshold(), embeddingService.version());
            } else {
                methodUsed = "exact (fallback)";
                if (settings.method() == Method.SEMANTIC) {
                    Dataset deduplicated = exactDeduplicate(current, columns, settings.keep());
                    exactRemoved = current.rowCount() - deduplicated.rowCount();
                    current = deduplicated;
                    log.info("dedup.exact removed={} columns={}", exactRemoved, columns.size());
                }
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("exact_duplicates_removed", exactRemoved);
        metadata.put("semantic_duplicates_removed", semanticRemoved);
        metadata.put("method_used", methodUsed);
        metadata.put("columns_checked", columns);
        return StepResult.of(rowsBefore, current, metadata, warnings);
    }

    private static List<String> resolveColumns(Dataset dataset, List<String> requested, List<String> warnings) {
        if (requested.isEmpty()) {
            return dataset.columnNames();
        }
        List<String> present = requested.stream().filter(dataset::hasColumn).toList();
        if (present.isEmpty()) {
            warnings.add("Specified columns not found, using all columns");
            return dataset.columnNames();
        }
        return present;
    }

    static Dataset exactDeduplicate(Dataset dataset, List<String> columns, Keep keep) {
        int rows = dataset.rowCount();
        List<String> hashes = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            hashes.add(rowHash(dataset, i, columns));
        }
        boolean[] retain = new boolean[rows];
        Set<String> seen = new HashSet<>();
        if (keep == Keep.FIRST) {
            for (int i = 0; i < rows; i++) {
                retain[i] = seen.add(hashes.get(i));
            }
        } else {
            for (int i = rows - 1; i >= 0; i--) {
                retain[i] = seen.add(hashes.get(i));
            }
        }
        return dataset.filterRows(i -> retain[i]);
    }

    /**
     * Drops near-duplicate rows, or returns empty when the embedding service fails part way. All rows are embedded
     * up front so a failure leaves the dataset untouched for the exact fallback.
     */
    private Optional<Dataset> semanticDeduplicate(Dataset dataset, List<String> columns, Settings settings,
            List<String> warnings) {
        int rows = dataset.rowCount();
        if (rows < 2) {
            return Optional.of(dataset);
        }
        List<String> texts = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            texts.add(joinedText(dataset, i, columns, " "));
        }
        List<float[]> embeddings;
        try {
            embeddings = embeddingService.embedAll(texts);
        } catch (IOException e) {
            log.warn("dedup.semantic.failed embedding={} reason={}", embeddingService.version(), e.getMessage());
            warnings.add("Semantic embedding failed (" + e.getMessage() + "). Falling back to exact dedup only.");
            return Optional.empty();
        }
        NearestNeighborIndex index = NearestNeighborIndex.of(embeddings);
        int topK = Math.min(settings.semanticTopK(), rows);

        Set<Integer> removed = new HashSet<>();
        for (int i = 0; i < rows; i++) {
            if (removed.contains(i)) {
                continue;
            }
            for (NearestNeighborIndex.Neighbor neighbor : index.search(embeddings.get(i), topK)) {
                int j = neighbor.index();
                if (j == i || removed.contains(j) || neighbor.score() < settings.semanticThreshold()) {
                    continue;
                }
                int later = Math.max(i, j);
                int earlier = Math.min(i, j);
                int drop = settings.keep() == Keep.FIRST ? later : earlier;
                removed.add(drop);
                if (drop == i) {
                    break;
                }
            }
        }
        return Optional.of(dataset.filterRows(i -> !removed.contains(i)));
    }

    private static String rowHash(Dataset dataset, int row, List<String> columns) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(joinedText(dataset, row, columns, "|").getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Missing SHA-256 algorithm", e);
        }
    }

    private static String joinedText(Dataset dataset, int row, List<String> columns, String separator) {
        StringBuilder builder = new StringBuilder();
        for (int c = 0; c < columns.size(); c++) {
            if (c > 0) {
                builder.append(separator);
            }
            builder.append(dataset.text(row, columns.get(c)));
        }
        return builder.toString();
    }
}
