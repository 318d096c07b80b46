package com.dataforge.finetune;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;

/**
 * Splits a dataset into train and validation parts, stratified by a category column when every class can be
 * represented on both sides.
 */
public class TrainValSplitter {
    private static final Logger log = LoggerFactory.getLogger(TrainValSplitter.class);
    private static final double EPSILON = 1e-9;

    private final double valSplit;
    private final boolean shuffle;
    private final long seed;

    public TrainValSplitter(double valSplit, boolean shuffle, long seed) {
        if (valSplit < 0 || valSplit >= 1) {
            throw new IllegalArgumentException("val_split must be in [0, 1): " + valSplit);
        }
        this.valSplit = valSplit;
        this.shuffle = shuffle;
        this.seed = seed;
    }

    public record Split(Dataset train, Dataset validation, boolean stratified) {
    }

    /**
     * @param stratifyColumn category column to stratify on, or {@code null} for a plain random split
     */
    public Split split(Dataset dataset, String stratifyColumn) {
        int total = dataset.rowCount();
        if (total < 2) {
            return new Split(dataset, dataset.filterRows(row -> false), false);
        }
        int validationSize = validationSize(total);
        if (stratifyColumn != null && shuffle && dataset.hasColumn(stratifyColumn)) {
            List<List<Integer>> classes = classes(dataset, stratifyColumn);
            if (canStratify(classes, validationSize, total - validationSize)) {
                return stratifiedSplit(dataset, classes, validationSize);
            }
            log.info("finetune.split.stratify.fallback column={} classes={} total={}",
                    stratifyColumn, classes.size(), total);
        }
        List<Integer> order = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            order.add(i);
        }
        if (!shuffle) {
            return new Split(
                    dataset.selectRows(order.subList(0, total - validationSize)),
                    dataset.selectRows(order.subList(total - validationSize, total)),
                    false);
        }
        Collections.shuffle(order, new Random(seed));
        return new Split(
                dataset.selectRows(order.subList(validationSize, total)),
                dataset.selectRows(order.subList(0, validationSize)),
                false);
    }

    int validationSize(int total) {
        int size = (int) Math.ceil(total * valSplit - EPSILON);
        return Math.max(1, Math.min(total - 1, size));
    }

    private static List<List<Integer>> classes(Dataset dataset, String column) {
        Map<String, List<Integer>> byClass = new TreeMap<>();
        for (int row = 0; row < dataset.rowCount(); row++) {
            byClass.computeIfAbsent(dataset.text(row, column), unused -> new ArrayList<>()).add(row);
        }
        return new ArrayList<>(byClass.values());
    }

    private static boolean canStratify(List<List<Integer>> classes, int validationSize, int trainSize) {
        return classes.size() > 1
                && classes.stream().allMatch(members -> members.size() >= 2)
                && validationSize >= classes.size()
                && trainSize >= classes.size();
    }

    private Split stratifiedSplit(Dataset dataset, List<List<Integer>> classes, int validationSize) {
        int total = dataset.rowCount();
        int[] allocation = new int[classes.size()];
        double[] exact = new double[classes.size()];
        int allocated = 0;
        for (int c = 0; c < classes.size(); c++) {
            int size = classes.get(c).size();
            exact[c] = (double) validationSize * size / total;
            allocation[c] = Math.max(1, Math.min(size - 1, (int) Math.floor(exact[c] + EPSILON)));
            allocated += allocation[c];
        }
        while (allocated < validationSize) {
            int pick = -1;
            for (int c = 0; c < classes.size(); c++) {
                if (allocation[c] < classes.get(c).size() - 1
                        && (pick < 0 || exact[c] - allocation[c] > exact[pick] - allocation[pick])) {
                    pick = c;
                }
            }
            allocation[pick]++;
            allocated++;
        }
        while (allocated > validationSize) {
            int pick = -1;
            for (int c = 0; c < classes.size(); c++) {
                if (allocation[c] > 1 && (pick < 0 || exact[c] - allocation[c] < exact[pick] - allocation[pick])) {
                    pick = c;
                }
            }
            allocation[pick]--;
            allocated--;
        }

        Random random = new Random(seed);
        List<Integer> train = new ArrayList<>();
        List<Integer> validation = new ArrayList<>();
        for (int c = 0; c < classes.size(); c++) {
            List<Integer> members = new ArrayList<>(classes.get(c));
            Collections.shuffle(members, random);
            validation.addAll(members.subList(0, allocation[c]));
            train.addAll(members.subList(allocation[c], members.size()));
        }
        Collections.shuffle(train, random);
        Collections.shuffle(validation, random);
        return new Split(dataset.selectRows(train), dataset.selectRows(validation), true);
    }
}
