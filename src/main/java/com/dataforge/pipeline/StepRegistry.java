package com.dataforge.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

public final class StepRegistry {
    private final Map<String, Supplier<? extends PipelineStep>> factories;

    private StepRegistry(Map<String, Supplier<? extends PipelineStep>> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<PipelineStep> lookup(String name) {
        Supplier<? extends PipelineStep> factory = name == null ? null : factories.get(name);
        return factory == null ? Optional.empty() : Optional.of(factory.get());
    }

    public boolean contains(String name) {
        return factories.containsKey(name);
    }

    public List<String> names() {
        return List.copyOf(factories.keySet());
    }

    public Map<String, String> describe() {
        Map<String, String> descriptions = new LinkedHashMap<>();
        factories.forEach((name, factory) -> descriptions.put(name, factory.get().description()));
        return descriptions;
    }

    public static final class Builder {
        private final Map<String, Supplier<? extends PipelineStep>> factories = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name, Supplier<? extends PipelineStep> factory) {
            if (factories.putIfAbsent(name, factory) != null) {
                throw new IllegalArgumentException("Step already registered: " + name);
            }
            return this;
        }

        public Builder register(Supplier<? extends PipelineStep> factory) {
            return register(factory.get().name(), factory);
        }

        public StepRegistry build() {
            return new StepRegistry(factories);
        }
    }
}
