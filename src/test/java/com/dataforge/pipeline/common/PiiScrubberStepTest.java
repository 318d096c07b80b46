package com.dataforge.pipeline.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.dataforge.dataset.Dataset;
import com.dataforge.pii.OpenNlpPiiDetector;
import com.dataforge.pii.PiiDetector;
import com.dataforge.pii.PiiMatch;
import com.dataforge.pipeline.StepResult;

class PiiScrubberStepTest {

    private final PiiScrubberStep regexOnly = new PiiScrubberStep(OpenNlpPiiDetector.load(Map.of()));

    @Test
    void shouldRedactEmailAddresses() {
        Dataset dataset = Dataset.fromColumns(Map.of("text", List.of("Contact me at john@example.com today")));

        StepResult result = regexOnly.run(dataset, Map.of());

        assertEquals("Contact me at [REDACTED] today", result.dataset().value(0, "text"));
        assertEquals(1, result.metadata().get("rows_with_pii"));
        assertEquals(Map.of("EMAIL", 1), result.metadata().get("entities_found"));
        assertTrue(result.warnings().contains("NER models not available, using regex patterns only."));
    }

    @Test
    void shouldRedactWithEntityTypeToken() {
        Dataset dataset = Dataset.fromColumns(Map.of("text", List.of(
                "Mail john@example.com or visit https://example.org/about")));

        StepResult result = regexOnly.run(dataset, Map.of("redact_with", "<ENTITY_TYPE>"));

        assertEquals("Mail <EMAIL> or visit <URL>", result.dataset().value(0, "text"));
    }

    @Test
    void shouldOnlyLookForRequestedEntities() {
        Dataset dataset = Dataset.fromColumns(Map.of("text", List.of("Mail john@example.com or visit www.example.org")));

        StepResult result = regexOnly.run(dataset, Map.of("entities", List.of("url")));

        assertEquals("Mail john@example.com or visit [REDACTED]", result.dataset().value(0, "text"));
    }

    @Test
    void shouldFlagRowsWithoutChangingText() {
        Dataset dataset = Dataset.fromColumns(Map.of("text", List.of("reach me at jane@example.com", "no secrets here")));

        StepResult result = regexOnly.run(dataset, Map.of("action", "flag"));

        assertEquals("reach me at jane@example.com", result.dataset().value(0, "text"));
        assertEquals(List.of(true, false), result.dataset().column(PiiScrubberStep.FLAG_COLUMN));
        assertEquals(List.of("EMAIL", ""), result.dataset().column(PiiScrubberStep.ENTITIES_COLUMN));
        assertEquals(0, result.rowsRemoved());
    }

    @Test
    void shouldRemoveRowsContainingPii() {
        Dataset dataset = Dataset.fromColumns(Map.of("text", List.of("reach me at jane@example.com", "no secrets here")));

        StepResult result = regexOnly.run(dataset, Map.of("action", "remove_row"));

        assertEquals(List.of("no secrets here"), result.dataset().column("text"));
        assertFalse(result.dataset().hasColumn(PiiScrubberStep.FLAG_COLUMN));
        assertEquals(1, result.rowsRemoved());
    }

    @Test
    void shouldCombineNamedEntitiesWithRegexMatches() {
        Dataset dataset = Dataset.fromColumns(Map.of("text", List.of("Alice wrote to bob@example.com")));
        PiiScrubberStep step = new PiiScrubberStep(new KeywordNameDetector("Alice"));

        StepResult result = step.run(dataset, Map.of("redact_with", "<ENTITY_TYPE>"));

        assertEquals("<PERSON> wrote to <EMAIL>", result.dataset().value(0, "text"));
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void shouldPreferLongestMatchWhenSpansOverlap() {
        List<PiiMatch> resolved = PiiScrubberStep.resolveOverlaps(List.of(
                new PiiMatch("URL", 5, 8),
                new PiiMatch("EMAIL", 0, 10),
                new PiiMatch("PHONE", 12, 20)));

        assertEquals(List.of(new PiiMatch("EMAIL", 0, 10), new PiiMatch("PHONE", 12, 20)), resolved);
    }

    @Test
    void shouldSkipNonTextColumns() {
        Dataset dataset = Dataset.fromColumns(Map.of("count", List.of(1, 2)));

        StepResult result = regexOnly.run(dataset, Map.of());

        assertEquals(List.of("No text columns found for PII scanning."), result.warnings());
        assertEquals(0, result.metadata().get("rows_with_pii"));
    }

    private static final class KeywordNameDetector implements PiiDetector {
        private final String name;

        private KeywordNameDetector(String name) {
            this.name = name;
        }

        @Override
        public List<PiiMatch> detect(String text, Set<String> entities) {
            List<PiiMatch> matches = new ArrayList<>();
            int index = text.indexOf(name);
            if (entities.contains("PERSON") && index >= 0) {
                matches.add(new PiiMatch("PERSON", index, index + name.length()));
            }
            return matches;
        }

        @Override
        public Set<String> supportedEntities() {
            return Set.of("PERSON");
        }
    }
}
