package com.dataforge.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DatasetLoaderTest {

    @TempDir
    Path tempDir;

    private final DatasetLoader loader = new DatasetLoader();

    @Test
    void shouldLoadJsonArray() throws Exception {
        Path file = tempDir.resolve("rows.json");
        Files.writeString(file, """
                [
                  {"text": "first", "label": "a"},
                  {"text": "second", "label": "b"}
                ]
                """);

        Dataset dataset = loader.load(file);

        assertEquals(2, dataset.rowCount());
        assertEquals(List.of("text", "label"), dataset.columnNames());
        assertEquals("second", dataset.value(1, "text"));
    }

    @Test
    void shouldLoadJsonLinesSkippingBlankLines() throws Exception {
        Path file = tempDir.resolve("rows.jsonl");
        Files.writeString(file, """
                {"text": "first"}

                {"text": "second", "extra": 1}
                """);

        Dataset dataset = loader.load(file);

        assertEquals(2, dataset.rowCount());
        assertNull(dataset.value(0, "extra"));
    }

    @Test
    void shouldCoerceNumericCsvColumns() throws Exception {
        Path file = tempDir.resolve("rows.csv");
        Files.writeString(file, """
                id,text,score
                1,hello,0.5
                2,world,
                """);

        Dataset dataset = loader.load(file);

        assertEquals(ColumnType.NUMBER, dataset.columnType("id"));
        assertEquals(ColumnType.TEXT, dataset.columnType("text"));
        assertEquals(1L, dataset.value(0, "id"));
        assertEquals(0.5, dataset.value(0, "score"));
        assertNull(dataset.value(1, "score"));
    }

    @Test
    void shouldLoadTabSeparatedFiles() throws Exception {
        Path file = tempDir.resolve("rows.tsv");
        Files.writeString(file, "question\tanswer\nWhat is it\tA thing\n");

        Dataset dataset = loader.load(file);

        assertEquals(1, dataset.rowCount());
        assertEquals("A thing", dataset.value(0, "answer"));
    }

    @Test
    void shouldProbeContentWhenExtensionIsUnknown() throws Exception {
        Path file = tempDir.resolve("rows.data");
        Files.writeString(file, "{\"text\": \"a\"}\n{\"text\": \"b\"}\n");

        assertEquals(DatasetLoader.Format.JSONL, loader.detectFormat(file));
        assertEquals(2, loader.load(file).rowCount());
    }

    @Test
    void shouldReturnEmptyDatasetForMalformedInput() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "[{\"text\": ");

        assertTrue(loader.load(file).isEmpty());
        assertTrue(loader.load(tempDir.resolve("missing.json")).isEmpty());
    }
}
