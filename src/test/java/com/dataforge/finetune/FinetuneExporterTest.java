package com.dataforge.finetune;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.dataforge.dataset.Dataset;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

class FinetuneExporterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final FinetuneExporter exporter = new FinetuneExporter(mapper);

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteJsonArrayForAlpaca() throws Exception {
        Dataset dataset = formatted(List.of(
                Map.of("instruction", "a", "input", "", "output", "b"),
                Map.of("instruction", "c", "input", "", "output", "d")));

        Path file = exporter.export(dataset, OutputFormat.ALPACA, tempDir.resolve("nested/out/train.json"));

        JsonNode root = mapper.readTree(file.toFile());
        assertTrue(root.isArray());
        assertEquals(2, root.size());
        assertEquals("d", root.get(1).get("output").asText());
    }

    @Test
    void shouldWriteOneJsonObjectPerLineForOpenAi() throws Exception {
        Dataset dataset = formatted(List.of(
                Map.of("messages", List.of(Map.of("role", "user", "content", "hi"))),
                Map.of("messages", List.of(Map.of("role", "user", "content", "bye")))));

        String content = new String(exporter.render(dataset, OutputFormat.OPENAI), StandardCharsets.UTF_8);

        List<String> lines = content.lines().toList();
        assertEquals(2, lines.size());
        assertEquals("bye", mapper.readTree(lines.get(1)).at("/messages/0/content").asText());
    }

    @Test
    void shouldWrapTemplateStringsInTextObjects() throws Exception {
        Dataset dataset = formatted(List.of("<s>[INST] q [/INST] a</s>"));

        String content = new String(exporter.render(dataset, OutputFormat.MISTRAL), StandardCharsets.UTF_8);

        assertEquals("<s>[INST] q [/INST] a</s>", mapper.readTree(content.strip()).get("text").asText());
    }

    @Test
    void shouldWriteEmptyFileForEmptyDataset() throws Exception {
        Path file = exporter.export(Dataset.empty(), OutputFormat.OPENAI, tempDir.resolve("empty.jsonl"));

        assertEquals(0, Files.size(file));
    }

    @Test
    void shouldSerializeTrainingConfigWithSnakeCaseKeys() throws Exception {
        TrainingConfigDescriptor descriptor = TrainingConfigDescriptor.recommend(50, 12.0, OutputFormat.LLAMA3);

        Path file = exporter.exportTrainingConfig(descriptor, tempDir.resolve("config/training.json"));

        JsonNode root = mapper.readTree(file.toFile());
        assertEquals("meta-llama/Meta-Llama-3-8B-Instruct", root.get("model_recommendation").asText());
        assertEquals("llama3", root.get("dataset_format").asText());
        assertEquals(50, root.get("num_examples").asInt());
        assertEquals(10, root.get("recommended_epochs").asInt());
        assertEquals(4, root.get("recommended_batch_size").asInt());
        assertTrue(root.get("frameworks").has("unsloth"));
    }

    private static Dataset formatted(List<?> records) {
        return Dataset.fromColumns(Map.of(FinetuneFormatterStep.FORMATTED_TEXT, records));
    }
}
