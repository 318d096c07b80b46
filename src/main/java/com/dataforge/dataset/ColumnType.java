package com.dataforge.dataset;

import java.util.List;

public enum ColumnType {
    TEXT,
    NUMBER,
    BOOLEAN,
    OBJECT;

    static ColumnType infer(List<Object> values) {
        ColumnType inferred = null;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            ColumnType current = of(value);
            if (inferred == null) {
                inferred = current;
            } else if (inferred != current) {
                return OBJECT;
            }
        }
        return inferred == null ? TEXT : inferred;
    }

    private static ColumnType of(Object value) {
        if (value instanceof CharSequence) {
            return TEXT;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        return OBJECT;
    }
}
