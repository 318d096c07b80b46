package com.dataforge.finetune;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.dataforge.dataset.Dataset;
import com.dataforge.pipeline.StepConfigException;
import com.dataforge.pipeline.StepResult;

class CategoryBalancerStepTest {

    private final CategoryBalancerStep step = new CategoryBalancerStep();

    @Test
    void shouldUndersampleToMinorityClass() {
        Dataset dataset = imbalanced(100, 10);

        StepResult result = step.run(dataset, Map.of());

        assertEquals(20, result.rowsAfter());
        assertEquals("category", result.metadata().get(CategoryBalancerStep.CATEGORY_COLUMN_KEY));
        assertEquals(Map.of("A", 100, "B", 10), result.metadata().get("distribution_before"));
        assertEquals(Map.of("A", 10, "B", 10), result.metadata().get("distribution_after"));
        assertEquals("undersample", result.metadata().get("method"));
    }

    @Test
    void shouldOversampleToMajorityClass() {
        Dataset dataset = imbalanced(100, 10);

        StepResult result = step.run(dataset, Map.of("method", "oversample"));

        assertEquals(200, result.rowsAfter());
        assertEquals(-90, result.rowsRemoved());
        assertEquals(Map.of("A", 100, "B", 100), result.metadata().get("distribution_after"));
    }

    @Test
    void shouldFallBackToOversampleForAugment() {
        StepResult result = step.run(imbalanced(20, 5), Map.of("method", "augment", "target_column", "category"));

        assertEquals("oversample", result.metadata().get("method"));
        assertEquals(40, result.rowsAfter());
        assertEquals(List.of("'augment' method requires async AI generation. Falling back to 'oversample'."),
                result.warnings());
    }

    @Test
    void shouldApplyCapsAndBalanceRatio() {
        Dataset dataset = imbalanced(100, 10);

        StepResult capped = step.run(dataset, Map.of("max_per_category", 5));
        StepResult ratio = step.run(dataset, Map.of("balance_ratio", 0.5));

        assertEquals(Map.of("A", 5, "B", 5), capped.metadata().get("distribution_after"));
        assertEquals(Map.of("A", 20, "B", 10), ratio.metadata().get("distribution_after"));
        assertThrows(StepConfigException.class, () -> step.validateConfig(Map.of("balance_ratio", 0)));
    }

    @Test
    void shouldBeDeterministicForSameSeed() {
        Dataset dataset = imbalanced(30, 6);

        Dataset first = step.run(dataset, Map.of("seed", 7)).dataset();
        Dataset second = step.run(dataset, Map.of("seed", 7)).dataset();

        assertEquals(first.column("text"), second.column("text"));
    }

    @Test
    void shouldCarryUncategorizedRowsThrough() {
        List<Object> categories = new ArrayList<>(List.of("A", "A", "A", "B"));
        categories.add(null);
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("category", categories);
        columns.put("text", List.of("t1", "t2", "t3", "t4", "t5"));

        StepResult result = step.run(Dataset.fromColumns(columns), Map.of("target_column", "category"));

        assertEquals(3, result.rowsAfter());
        assertTrue(result.dataset().column("text").contains("t5"));
    }

    @Test
    void shouldSkipWhenNoCategoryColumnCanBeFound() {
        Dataset dataset = Dataset.fromColumns(Map.of("text", List.of("one", "two", "three")));

        StepResult auto = step.run(dataset, Map.of("max_auto_categories", 2));
        StepResult missing = step.run(dataset, Map.of("target_column", "label"));

        assertEquals("skipped_no_column", auto.metadata().get("status"));
        assertEquals(List.of("Could not auto-detect a category column. Balancer skipped."), auto.warnings());
        assertEquals("skipped_missing_column", missing.metadata().get("status"));
        assertEquals(List.of("Target column 'label' not found. Balancer skipped."), missing.warnings());
        assertSame(dataset, missing.dataset());
    }

    @Test
    void shouldPassEmptyDatasetThrough() {
        StepResult result = step.run(Dataset.empty(), Map.of());

        assertTrue(result.metadata().isEmpty());
        assertEquals(0, result.rowsAfter());
    }

    @Test
    void shouldIgnoreFormatterColumnsWhenDetecting() {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put(FinetuneFormatterStep.NORM_INPUT, List.of("", "", "x"));
        columns.put("topic", List.of("math", "art", "math"));

        assertEquals("topic", CategoryBalancerStep.detectCategoryColumn(Dataset.fromColumns(columns), 50));
    }

    private static Dataset imbalanced(int countA, int countB) {
        List<String> categories = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        for (int i = 0; i < countA; i++) {
            categories.add("A");
            texts.add("sample text a" + i);
        }
        for (int i = 0; i < countB; i++) {
            categories.add("B");
            texts.add("sample text b" + i);
        }
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("category", categories);
        columns.put("text", texts);
        return Dataset.fromColumns(columns);
    }
}
