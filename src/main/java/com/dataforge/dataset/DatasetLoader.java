package com.dataforge.dataset;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

public class DatasetLoader {
    private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);
    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> ROW = new TypeReference<>() {
    };

    private final ObjectMapper jsonMapper = JsonMapper.builder().findAndAddModules().build();
    private final CsvMapper csvMapper = new CsvMapper();

    public enum Format {
        JSON,
        JSONL,
        CSV,
        TSV
    }

    public Dataset load(Path path) {
        try {
            Format format = detectFormat(path);
            Dataset dataset = readAs(path, format);
            log.info("dataset.loaded path={} format={} rows={} columns={}",
                    path, format, dataset.rowCount(), dataset.columnNames());
            return dataset;
        } catch (IOException | RuntimeException e) {
            log.error("dataset.load.failed path={} reason={}", path, e.getMessage(), e);
            return Dataset.empty();
        }
    }

    Format detectFormat(Path path) throws IOException {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".jsonl") || fileName.endsWith(".ndjson")) {
            return Format.JSONL;
        }
        if (fileName.endsWith(".json")) {
            return Format.JSON;
        }
        if (fileName.endsWith(".tsv")) {
            return Format.TSV;
        }
        if (fileName.endsWith(".csv")) {
            return Format.CSV;
        }
        String content = Files.readString(path, StandardCharsets.UTF_8).stripLeading();
        if (content.startsWith("[")) {
            return Format.JSON;
        }
        if (content.startsWith("{")) {
            long objectLines = content.lines().filter(line -> line.strip().startsWith("{")).count();
            return objectLines > 1 ? Format.JSONL : Format.JSON;
        }
        return Format.CSV;
    }

    private Dataset readAs(Path path, Format format) throws IOException {
        if (format == Format.JSON) {
            return readJson(path);
        }
        if (format == Format.JSONL) {
            return readJsonLines(path);
        }
        return readDelimited(path, format == Format.TSV ? '\t' : ',');
    }

    private Dataset readJson(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8).strip();
        if (content.startsWith("{")) {
            return Dataset.fromRows(List.of(jsonMapper.readValue(content, ROW)));
        }
        return Dataset.fromRows(jsonMapper.readValue(content, ROWS));
    }

    private Dataset readJsonLines(Path path) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            rows.add(jsonMapper.readValue(line, ROW));
        }
        return Dataset.fromRows(rows);
    }

    private Dataset readDelimited(Path path, char separator) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(separator);
        List<Map<String, Object>> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                MappingIterator<Map<String, String>> iterator = csvMapper
                        .readerFor(new TypeReference<Map<String, String>>() {
                        })
                        .with(schema)
                        .readValues(reader)) {
            while (iterator.hasNext()) {
                rows.add(new LinkedHashMap<>(iterator.next()));
            }
        }
        return coerceNumericColumns(Dataset.fromRows(rows));
    }

    private static Dataset coerceNumericColumns(Dataset dataset) {
        Dataset result = dataset;
        for (String column : dataset.columnNames()) {
            List<Object> values = dataset.column(column);
            List<Object> converted = new ArrayList<>(values.size());
            boolean numeric = true;
            boolean anyValue = false;
            for (Object value : values) {
                String text = value == null ? "" : value.toString().strip();
                if (text.isEmpty()) {
                    converted.add(null);
                    continue;
                }
                anyValue = true;
                Number number = parseNumber(text);
                if (number == null) {
                    numeric = false;
                    break;
                }
                converted.add(number);
            }
            if (numeric && anyValue) {
                result = result.withColumn(column, converted);
            } else if (!numeric) {
                result = result.withColumn(column, blanksToNull(values));
            }
        }
        return result;
    }

    private static List<Object> blanksToNull(List<Object> values) {
        List<Object> cleaned = new ArrayList<>(values.size());
        for (Object value : values) {
            cleaned.add(value == null || value.toString().isEmpty() ? null : value);
        }
        return cleaned;
    }

    private static Number parseNumber(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
    }
}
