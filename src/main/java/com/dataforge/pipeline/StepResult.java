package com.dataforge.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.dataforge.dataset.Dataset;

/**
 * Outcome of one step. {@code rowsRemoved} is the row-count delta and is negative for steps that add rows.
 */
public record StepResult(
        Dataset dataset,
        int rowsBefore,
        int rowsAfter,
        int rowsRemoved,
        Map<String, Object> metadata,
        List<String> warnings) {

    public StepResult {
        if (rowsBefore < 0 || rowsAfter < 0) {
            throw new IllegalArgumentException("Row counts must be non-negative");
        }
        if (rowsAfter != rowsBefore - rowsRemoved) {
            throw new IllegalArgumentException("rowsAfter must equal rowsBefore - rowsRemoved");
        }
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        warnings = List.copyOf(warnings);
    }

    public static StepResult of(int rowsBefore, Dataset dataset, Map<String, Object> metadata, List<String> warnings) {
        return new StepResult(dataset, rowsBefore, dataset.rowCount(), rowsBefore - dataset.rowCount(), metadata, warnings);
    }

    public static StepResult unchanged(Dataset dataset, Map<String, Object> metadata, List<String> warnings) {
        return of(dataset.rowCount(), dataset, metadata, warnings);
    }

    public static StepResult skipped(Dataset dataset, String reason, String warning) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("skipped", true);
        metadata.put("reason", reason);
        return unchanged(dataset, metadata, List.of(warning));
    }

    public boolean isSkipped() {
        return Boolean.TRUE.equals(metadata.get("skipped"));
    }

    public String summary() {
        return rowsRemoved + " rows removed (" + rowsBefore + " -> " + rowsAfter + ")";
    }
}
