package com.dataforge.dataset;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.function.UnaryOperator;

/**
 * Immutable column-major table. Cells may be {@code null}; every transformation returns a new instance.
 */
public final class Dataset {
    private static final Dataset EMPTY = new Dataset(new LinkedHashMap<>(), 0);

    private final Map<String, List<Object>> columns;
    private final Map<String, ColumnType> types;
    private final int rowCount;

    private Dataset(LinkedHashMap<String, List<Object>> columns, int rowCount) {
        this.columns = Collections.unmodifiableMap(columns);
        this.rowCount = rowCount;
        Map<String, ColumnType> inferred = new LinkedHashMap<>();
        columns.forEach((name, values) -> inferred.put(name, ColumnType.infer(values)));
        this.types = Collections.unmodifiableMap(inferred);
    }

    public static Dataset empty() {
        return EMPTY;
    }

    public static Dataset fromRows(List<? extends Map<String, ?>> rows) {
        LinkedHashMap<String, List<Object>> columns = new LinkedHashMap<>();
        for (Map<String, ?> row : rows) {
            for (String name : row.keySet()) {
                columns.computeIfAbsent(name, unused -> new ArrayList<>());
            }
        }
        for (Map<String, ?> row : rows) {
            columns.forEach((name, values) -> values.add(row.get(name)));
        }
        return new Dataset(freeze(columns), rows.size());
    }

    public static Dataset fromColumns(Map<String, ? extends List<?>> source) {
        LinkedHashMap<String, List<Object>> columns = new LinkedHashMap<>();
        int size = -1;
        for (Map.Entry<String, ? extends List<?>> entry : source.entrySet()) {
            if (size >= 0 && entry.getValue().size() != size) {
                throw new IllegalArgumentException("Column " + entry.getKey() + " has " + entry.getValue().size()
                        + " values, expected " + size);
            }
            size = entry.getValue().size();
            columns.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
        return new Dataset(freeze(columns), Math.max(0, size));
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Optional<String> findColumnIgnoreCase(String name) {
        return columns.keySet().stream()
                .filter(column -> column.toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    public ColumnType columnType(String name) {
        ColumnType type = types.get(name);
        if (type == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return type;
    }

    public List<String> textColumns() {
        return types.entrySet().stream()
                .filter(entry -> entry.getValue() == ColumnType.TEXT)
                .map(Map.Entry::getKey)
                .toList();
    }

    public List<Object> column(String name) {
        List<Object> values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return values;
    }

    public Object value(int row, String column) {
        return column(column).get(row);
    }

    public String text(int row, String column) {
        Object value = value(row, column);
        return value == null ? "" : String.valueOf(value);
    }

    public Map<String, Object> row(int index) {
        Map<String, Object> row = new LinkedHashMap<>();
        columns.forEach((name, values) -> row.put(name, values.get(index)));
        return row;
    }

    public List<Map<String, Object>> rows() {
        List<Map<String, Object>> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            rows.add(row(i));
        }
        return rows;
    }

    public Dataset selectRows(List<Integer> indices) {
        LinkedHashMap<String, List<Object>> selected = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            List<Object> picked = new ArrayList<>(indices.size());
            for (int index : indices) {
                picked.add(values.get(index));
            }
            selected.put(name, picked);
        });
        return new Dataset(freeze(selected), indices.size());
    }

    public Dataset filterRows(IntPredicate keep) {
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < rowCount; i++) {
            if (keep.test(i)) {
                kept.add(i);
            }
        }
        return kept.size() == rowCount ? this : selectRows(kept);
    }

    public Dataset withColumn(String name, List<?> values) {
        if (values.size() != rowCount) {
            throw new IllegalArgumentException("Column " + name + " has " + values.size()
                    + " values, dataset has " + rowCount + " rows");
        }
        LinkedHashMap<String, List<Object>> updated = new LinkedHashMap<>(columns);
        updated.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
        return new Dataset(updated, rowCount);
    }

    public Dataset mapColumn(String name, UnaryOperator<Object> mapper) {
        List<Object> mapped = new ArrayList<>(rowCount);
        for (Object value : column(name)) {
            mapped.add(mapper.apply(value));
        }
        return withColumn(name, mapped);
    }

    public Dataset withoutColumns(Collection<String> names) {
        Set<String> dropped = Set.copyOf(names);
        LinkedHashMap<String, List<Object>> remaining = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            if (!dropped.contains(name)) {
                remaining.put(name, values);
            }
        });
        return new Dataset(remaining, rowCount);
    }

    @Override
    public String toString() {
        return "Dataset[rows=" + rowCount + ", columns=" + columns.keySet() + "]";
    }

    private static LinkedHashMap<String, List<Object>> freeze(LinkedHashMap<String, List<Object>> columns) {
        columns.replaceAll((name, values) -> Collections.unmodifiableList(values));
        return columns;
    }
}
