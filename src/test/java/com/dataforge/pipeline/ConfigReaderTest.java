package com.dataforge.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ConfigReaderTest {

    enum Mode {
        FAST,
        SLOW_AND_STEADY
    }

    @Test
    void shouldFallBackToDefaultsForMissingKeys() {
        ConfigReader reader = ConfigReader.of("demo", null);

        assertEquals("x", reader.string("name", "x"));
        assertTrue(reader.bool("enabled", true));
        assertEquals(7, reader.integer("count", 7));
        assertNull(reader.optionalInteger("limit"));
        assertEquals(0.5, reader.decimal("ratio", 0.5));
        assertEquals(Mode.FAST, reader.choice("mode", Mode.FAST, Mode.class));
    }

    @Test
    void shouldCoerceStringValues() {
        ConfigReader reader = ConfigReader.of("demo", Map.of(
                "enabled", "False",
                "count", "12",
                "ratio", "0.25",
                "mode", "slow_and_steady"));

        assertFalse(reader.bool("enabled", true));
        assertEquals(12, reader.integer("count", 0));
        assertEquals(0.25, reader.decimal("ratio", 0.0));
        assertEquals(Mode.SLOW_AND_STEADY, reader.choice("mode", Mode.FAST, Mode.class));
    }

    @Test
    void shouldListAllowedChoicesWhenValueIsUnknown() {
        ConfigReader reader = ConfigReader.of("demo", Map.of("mode", "warp"));

        StepConfigException error = assertThrows(StepConfigException.class,
                () -> reader.choice("mode", Mode.FAST, Mode.class));

        assertEquals("demo", error.step());
        assertEquals("Invalid mode: warp. Use 'fast', 'slow_and_steady'.", error.getMessage());
    }

    @Test
    void shouldRejectMalformedNumbersAndBooleans() {
        ConfigReader reader = ConfigReader.of("demo", Map.of("count", "many", "enabled", "sometimes"));

        assertThrows(StepConfigException.class, () -> reader.integer("count", 1));
        assertThrows(StepConfigException.class, () -> reader.bool("enabled", true));
    }

    @Test
    void shouldTreatAllTokenAsNoColumnSelection() {
        ConfigReader all = ConfigReader.of("demo", Map.of("columns", "all"));
        ConfigReader some = ConfigReader.of("demo", Map.of("columns", List.of("a", "b")));
        ConfigReader single = ConfigReader.of("demo", Map.of("columns", "a"));

        assertTrue(all.columns("columns", "all").isEmpty());
        assertEquals(List.of("a", "b"), some.columns("columns", "all").orElseThrow());
        assertEquals(List.of("a"), single.columns("columns", "all").orElseThrow());
    }
}
