package com.dataforge.runtime;

import com.dataforge.finetune.CategoryBalancerStep;
import com.dataforge.finetune.DataAugmentorStep;
import com.dataforge.finetune.FinetuneFormatterStep;
import com.dataforge.finetune.ResponseQualityStep;
import com.dataforge.pipeline.StepRegistry;
import com.dataforge.pipeline.common.DeduplicationStep;
import com.dataforge.pipeline.common.LanguageFilterStep;
import com.dataforge.pipeline.common.NoiseRemovalStep;
import com.dataforge.pipeline.common.PiiScrubberStep;
import com.dataforge.pipeline.common.QualityScorerStep;

public final class StepRegistries {
    private StepRegistries() {
    }

    /**
     * Registers every built-in step, the common cleaning steps followed by the fine-tune steps.
     */
    public static StepRegistry defaults(StepServices services) {
        return StepRegistry.builder()
                .register(DeduplicationStep.NAME, () -> new DeduplicationStep(services.embedding()))
                .register(NoiseRemovalStep.NAME, NoiseRemovalStep::new)
                .register(PiiScrubberStep.NAME, () -> new PiiScrubberStep(services.nerDetector()))
                .register(LanguageFilterStep.NAME, () -> new LanguageFilterStep(services.languageDetector()))
                .register(QualityScorerStep.NAME, () -> new QualityScorerStep(services.scoring()))
                .register(FinetuneFormatterStep.NAME, FinetuneFormatterStep::new)
                .register(ResponseQualityStep.NAME, ResponseQualityStep::new)
                .register(CategoryBalancerStep.NAME, CategoryBalancerStep::new)
                .register(DataAugmentorStep.NAME, DataAugmentorStep::new)
                .build();
    }
}
