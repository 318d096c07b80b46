package com.dataforge.finetune;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.dataforge.dataset.Dataset;
import com.dataforge.pipeline.StepResult;

class ResponseQualityStepTest {

    private static final String INSTRUCTION = "Explain how photosynthesis works in plants";
    private static final String GOOD = "Photosynthesis converts light energy into chemical energy stored in glucose "
            + "molecules inside plant cells.";
    private static final String REFUSAL = "I'm sorry, but I cannot help with that request because it is not "
            + "allowed here.";
    private static final String UNFINISHED = "Photosynthesis converts light energy into chemical energy stored in "
            + "glucose molecules inside plant cells";

    private final ResponseQualityStep step = new ResponseQualityStep();

    @Test
    void shouldDropShortAndRefusingResponses() {
        Dataset dataset = normalized(
                List.of(INSTRUCTION, INSTRUCTION, INSTRUCTION, INSTRUCTION),
                List.of(GOOD, REFUSAL, "Yes.", UNFINISHED));

        StepResult result = step.run(dataset, Map.of());

        assertEquals(List.of(GOOD, UNFINISHED), result.dataset().column(FinetuneFormatterStep.NORM_OUTPUT));
        assertEquals(2, result.metadata().get("total_filtered"));
        assertEquals(6.0, result.metadata().get("avg_quality_score"));
        assertFalse(result.dataset().hasColumn(ResponseQualityStep.SCORE_COLUMN));
    }

    @Test
    void shouldKeepEveryRowAndAddScoresInScoreOnlyMode() {
        Dataset dataset = normalized(List.of("Hi", INSTRUCTION), List.of(GOOD, UNFINISHED));

        StepResult result = step.run(dataset, Map.of("action", "score_only"));

        assertEquals(0, result.rowsRemoved());
        assertEquals(List.of(5.0, 7.0), result.dataset().column(ResponseQualityStep.SCORE_COLUMN));
        assertEquals(List.of("instruction_too_short", "incomplete_response"),
                result.dataset().column(ResponseQualityStep.REASONS_COLUMN));
    }

    @Test
    void shouldApplyEachPenalty() {
        ResponseQualityStep.Settings settings = ResponseQualityStep.Settings.from(Map.of("max_response_length", 5));
        RefusalDetector refusals = new RefusalDetector(RefusalDetector.DEFAULT_PHRASES);

        ResponseQualityStep.Evaluation evaluation = ResponseQualityStep.evaluate("Hi", REFUSAL, settings, refusals);

        assertEquals(List.of("instruction_too_short", "response_too_long", "refusal_detected"), evaluation.reasons());
        assertEquals(0.0, evaluation.score());
    }

    @Test
    void shouldHonourCustomRefusalPhrasesAndToggles() {
        ResponseQualityStep.Settings settings = ResponseQualityStep.Settings.from(Map.of(
                "refusal_phrases", List.of("no comment"),
                "check_response_completeness", false));
        RefusalDetector refusals = new RefusalDetector(settings.refusalPhrases());

        assertTrue(refusals.isRefusal("Well, NO COMMENT on that."));
        assertFalse(refusals.isRefusal(REFUSAL));
        assertEquals(10.0, ResponseQualityStep.evaluate(INSTRUCTION, UNFINISHED, settings, refusals).score());
    }

    @Test
    void shouldFallBackToFirstAndLastColumns() {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("question", List.of(INSTRUCTION, INSTRUCTION));
        columns.put("answer", List.of(GOOD, "No."));
        Dataset dataset = Dataset.fromColumns(columns);

        StepResult result = step.run(dataset, Map.of());

        assertEquals(List.of(GOOD), result.dataset().column("answer"));
    }

    private static Dataset normalized(List<String> instructions, List<String> outputs) {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put(FinetuneFormatterStep.NORM_INSTRUCTION, instructions);
        columns.put(FinetuneFormatterStep.NORM_INPUT, instructions.stream().map(unused -> "").toList());
        columns.put(FinetuneFormatterStep.NORM_OUTPUT, outputs);
        return Dataset.fromColumns(columns);
    }
}
