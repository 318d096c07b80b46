package com.dataforge.finetune;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;
import com.dataforge.pipeline.ConfigReader;
import com.dataforge.pipeline.PipelineStep;
import com.dataforge.pipeline.StepResult;

/**
 * Placeholder for synthetic example generation. Generation needs the asynchronous generation worker, so the
 * synchronous step passes the dataset through and says so.
 */
public class DataAugmentorStep implements PipelineStep {
    public static final String NAME = "data_augmentor";
    static final String UNAVAILABLE_WARNING =
            "DataAugmentor requires the async AI generation worker. Skipped in synchronous runs.";
    private static final Logger log = LoggerFactory.getLogger(DataAugmentorStep.class);

    record Settings(String strategy, double multiplier, boolean preserveOriginals) {
        static Settings from(Map<String, Object> config) {
            ConfigReader reader = ConfigReader.of(NAME, config);
            return new Settings(
                    reader.string("strategy", "generate_similar"),
                    reader.decimal("multiplier", 2.0),
                    reader.bool("preserve_originals", true));
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Increase training examples using AI generation";
    }

    @Override
    public void validateConfig(Map<String, Object> config) {
        Settings.from(config);
    }

    @Override
    public StepResult run(Dataset dataset, Map<String, Object> config) {
        Settings settings = Settings.from(config);
        if (dataset.isEmpty()) {
            return StepResult.unchanged(dataset, Map.of(), List.of());
        }
        log.warn("finetune.augment.unavailable strategy={} multiplier={}", settings.strategy(), settings.multiplier());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("synthetic_examples_added", 0);
        metadata.put("original_preserved", settings.preserveOriginals());
        metadata.put("strategy", settings.strategy());
        return StepResult.unchanged(dataset, metadata, List.of(UNAVAILABLE_WARNING));
    }
}
