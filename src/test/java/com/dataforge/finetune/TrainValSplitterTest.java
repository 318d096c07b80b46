package com.dataforge.finetune;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.dataforge.dataset.Dataset;

class TrainValSplitterTest {

    @Test
    void shouldSplitByValidationFraction() {
        Dataset dataset = numbered(50, null);

        TrainValSplitter.Split split = new TrainValSplitter(0.2, true, 42).split(dataset, null);

        assertEquals(40, split.train().rowCount());
        assertEquals(10, split.validation().rowCount());
        assertFalse(split.stratified());
        Set<Object> all = new HashSet<>(split.train().column("id"));
        all.addAll(split.validation().column("id"));
        assertEquals(50, all.size());
    }

    @Test
    void shouldStratifyByCategory() {
        List<String> categories = new ArrayList<>(Collections.nCopies(10, "A"));
        categories.addAll(Collections.nCopies(10, "B"));
        Dataset dataset = numbered(20, categories);

        TrainValSplitter.Split split = new TrainValSplitter(0.2, true, 42).split(dataset, "category");

        assertTrue(split.stratified());
        assertEquals(8, Collections.frequency(split.train().column("category"), "A"));
        assertEquals(8, Collections.frequency(split.train().column("category"), "B"));
        assertEquals(2, Collections.frequency(split.validation().column("category"), "A"));
        assertEquals(2, Collections.frequency(split.validation().column("category"), "B"));
    }

    @Test
    void shouldFallBackToRandomWhenAClassIsTooSmall() {
        List<String> categories = new ArrayList<>(Collections.nCopies(9, "A"));
        categories.add("B");
        Dataset dataset = numbered(10, categories);

        TrainValSplitter.Split split = new TrainValSplitter(0.2, true, 42).split(dataset, "category");

        assertFalse(split.stratified());
        assertEquals(8, split.train().rowCount());
        assertEquals(2, split.validation().rowCount());
    }

    @Test
    void shouldKeepOrderWhenShuffleIsOff() {
        Dataset dataset = numbered(10, null);

        TrainValSplitter.Split split = new TrainValSplitter(0.2, false, 42).split(dataset, null);

        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7), split.train().column("id"));
        assertEquals(List.of(8, 9), split.validation().column("id"));
    }

    @Test
    void shouldPutSingleRowInTrain() {
        TrainValSplitter.Split split = new TrainValSplitter(0.1, true, 42).split(numbered(1, null), null);

        assertEquals(1, split.train().rowCount());
        assertTrue(split.validation().isEmpty());
    }

    @Test
    void shouldSizeValidationWithinBounds() {
        TrainValSplitter splitter = new TrainValSplitter(0.1, true, 42);

        assertEquals(3, splitter.validationSize(30));
        assertEquals(1, splitter.validationSize(5));
        assertEquals(1, new TrainValSplitter(0.9, true, 42).validationSize(2));
        assertThrows(IllegalArgumentException.class, () -> new TrainValSplitter(1.0, true, 42));
    }

    @Test
    void shouldBeReproducibleForSameSeed() {
        Dataset dataset = numbered(30, null);

        TrainValSplitter.Split first = new TrainValSplitter(0.2, true, 7).split(dataset, null);
        TrainValSplitter.Split second = new TrainValSplitter(0.2, true, 7).split(dataset, null);

        assertEquals(first.validation().column("id"), second.validation().column("id"));
    }

    private static Dataset numbered(int rows, List<String> categories) {
        List<Integer> ids = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            ids.add(i);
        }
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("id", ids);
        if (categories != null) {
            columns.put("category", categories);
        }
        return Dataset.fromColumns(columns);
    }
}
