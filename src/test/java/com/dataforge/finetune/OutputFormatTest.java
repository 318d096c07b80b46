package com.dataforge.finetune;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class OutputFormatTest {

    private final CanonicalExample example = new CanonicalExample("Summarize", "Long text", "Short text.");

    @Test
    void shouldJoinInstructionAndInputForUserTurn() {
        assertEquals("Summarize\nLong text", example.userTurn());
        assertEquals("Only", new CanonicalExample("Only", null, "x").userTurn());
    }

    @Test
    void shouldRenderChatTemplatesWithSystemPrompt() {
        assertEquals("<s>[INST] <<SYS>>Be brief<</SYS>> Summarize\nLong text [/INST] Short text. </s>",
                OutputFormat.LLAMA2.render(example, "Be brief"));
        assertEquals("<s>[INST] Be brief\n\nSummarize\nLong text [/INST] Short text.</s>",
                OutputFormat.MISTRAL.render(example, "Be brief"));
        assertEquals("<start_of_turn>user\nBe brief\n\nSummarize\nLong text<end_of_turn>\n"
                + "<start_of_turn>model\nShort text.<end_of_turn>",
                OutputFormat.GEMMA.render(example, "Be brief"));
        assertEquals("<|begin_of_text|><|start_header_id|>system<|end_header_id|>\nBe brief<|eot_id|>"
                + "<|start_header_id|>user<|end_header_id|>\nSummarize\nLong text<|eot_id|>"
                + "<|start_header_id|>assistant<|end_header_id|>\nShort text.<|eot_id|>",
                OutputFormat.LLAMA3.render(example, "Be brief"));
    }

    @Test
    void shouldRenderStructuredFormats() {
        assertEquals(Map.of("conversations", List.of(
                Map.of("from", "human", "value", "Summarize\nLong text"),
                Map.of("from", "gpt", "value", "Short text."))),
                OutputFormat.SHAREGPT.render(example, "ignored"));
        assertEquals(Map.of("messages", List.of(
                Map.of("role", "user", "content", "Summarize\nLong text"),
                Map.of("role", "assistant", "content", "Short text."))),
                OutputFormat.OPENAI.render(example, ""));
    }

    @Test
    void shouldParseIdentifiers() {
        assertEquals(OutputFormat.LLAMA3, OutputFormat.fromId(" Llama3 "));
        assertEquals(OutputFormat.OPENAI, OutputFormat.fromId(""));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.fromId("gpt5"));
        assertTrue(OutputFormat.ALPACA.exportsAsJsonArray());
        assertFalse(OutputFormat.OPENAI.exportsAsJsonArray());
        assertEquals(InputFormat.QA_PAIRS, InputFormat.fromId("qa_pairs"));
    }

    @Test
    void shouldRecommendModelAndEpochsFromDatasetSize() {
        TrainingConfigDescriptor small = TrainingConfigDescriptor.recommend(100, 123.44, OutputFormat.MISTRAL);
        TrainingConfigDescriptor large = TrainingConfigDescriptor.recommend(6000, 50, OutputFormat.OPENAI);

        assertEquals("mistralai/Mistral-7B-Instruct-v0.2", small.modelRecommendation());
        assertEquals(10, small.recommendedEpochs());
        assertEquals(123.4, small.avgTokens());
        assertEquals("meta-llama/Meta-Llama-3-8B-Instruct", large.modelRecommendation());
        assertEquals(3, large.recommendedEpochs());
        assertEquals(5, TrainingConfigDescriptor.recommend(2000, 10, OutputFormat.GEMMA).recommendedEpochs());
        assertTrue(large.frameworks().get("axolotl").contains("type: openai"));
    }
}
