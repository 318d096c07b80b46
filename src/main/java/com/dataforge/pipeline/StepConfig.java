package com.dataforge.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StepConfig(String step, Map<String, Object> config) {
    @JsonCreator
    public StepConfig(@JsonProperty("step") String step, @JsonProperty("config") Map<String, Object> config) {
        if (step == null || step.isBlank()) {
            throw new IllegalArgumentException("step name is required");
        }
        this.step = step;
        this.config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public static StepConfig of(String step) {
        return new StepConfig(step, Map.of());
    }

    public static StepConfig of(String step, Map<String, Object> config) {
        return new StepConfig(step, config);
    }
}
