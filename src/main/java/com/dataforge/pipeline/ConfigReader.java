package com.dataforge.pipeline;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Typed, default-filling view over a step's raw config map. Malformed values fail with {@link StepConfigException}.
 */
public final class ConfigReader {
    private final String step;
    private final Map<String, Object> config;

    private ConfigReader(String step, Map<String, Object> config) {
        this.step = step;
        this.config = config == null ? Map.of() : config;
    }

    public static ConfigReader of(String step, Map<String, Object> config) {
        return new ConfigReader(step, config);
    }

    public boolean has(String key) {
        return config.get(key) != null;
    }

    public String string(String key, String defaultValue) {
        Object value = config.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public boolean bool(String key, boolean defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if ("true".equals(text) || "false".equals(text)) {
            return Boolean.parseBoolean(text);
        }
        throw invalid(key, value, "expected true or false");
    }

    public int integer(String key, int defaultValue) {
        Integer value = optionalInteger(key);
        return value == null ? defaultValue : value;
    }

    public Integer optionalInteger(String key) {
        Object value = config.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return (int) Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid(key, value, "expected a number");
        }
    }

    public double decimal(String key, double defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid(key, value, "expected a number");
        }
    }

    public List<String> stringList(String key, List<String> defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of(value.toString());
    }

    /**
     * Returns the configured column list, or empty when the key is absent or holds {@code allToken}.
     */
    public Optional<List<String>> columns(String key, String allToken) {
        Object value = config.get(key);
        if (value == null || allToken.equals(value)) {
            return Optional.empty();
        }
        return Optional.of(stringList(key, List.of()));
    }

    public <E extends Enum<E>> E choice(String key, E defaultValue, Class<E> type) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        String name = value.toString().trim().toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            String allowed = Arrays.stream(type.getEnumConstants())
                    .map(constant -> "'" + constant.name().toLowerCase(Locale.ROOT) + "'")
                    .collect(Collectors.joining(", "));
            throw new StepConfigException(step, "Invalid " + key + ": " + value + ". Use " + allowed + ".");
        }
    }

    private StepConfigException invalid(String key, Object value, String expectation) {
        return new StepConfigException(step, "Invalid " + key + ": " + value + " (" + expectation + ")");
    }
}
