package com.dataforge.finetune;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum InputFormat {
    AUTO,
    SHAREGPT,
    ALPACA,
    QA_PAIRS,
    RAW_PAIRS,
    COLUMNS;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InputFormat fromId(String id) {
        if (id == null || id.isBlank()) {
            return AUTO;
        }
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
