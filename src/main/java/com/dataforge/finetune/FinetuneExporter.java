package com.dataforge.finetune;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serializes rendered examples: a pretty JSON array for alpaca and sharegpt, JSON Lines for everything else.
 */
public class FinetuneExporter {
    private static final Logger log = LoggerFactory.getLogger(FinetuneExporter.class);

    private final ObjectMapper mapper;

    public FinetuneExporter() {
        this(new ObjectMapper());
    }

    public FinetuneExporter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] render(Dataset dataset, OutputFormat format) throws IOException {
        if (dataset.isEmpty()) {
            return new byte[0];
        }
        String column = dataset.hasColumn(FinetuneFormatterStep.FORMATTED_TEXT)
                ? FinetuneFormatterStep.FORMATTED_TEXT
                : dataset.columnNames().get(0);
        List<Object> records = dataset.column(column);
        if (format.exportsAsJsonArray()) {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(records);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Object record : records) {
            Object line = record instanceof Map<?, ?> ? record : Map.of("text", String.valueOf(record));
            out.write(mapper.writeValueAsBytes(line));
            out.write('\n');
        }
        return out.toByteArray();
    }

    public Path export(Dataset dataset, OutputFormat format, Path target) throws IOException {
        byte[] bytes = render(dataset, format);
        writeFile(target, bytes);
        log.info("finetune.export.written path={} examples={} format={} bytes={}",
                target, dataset.rowCount(), format.id(), bytes.length);
        return target;
    }

    public byte[] renderTrainingConfig(TrainingConfigDescriptor descriptor) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(descriptor);
    }

    public Path exportTrainingConfig(TrainingConfigDescriptor descriptor, Path target) throws IOException {
        writeFile(target, renderTrainingConfig(descriptor));
        log.info("finetune.export.config path={} model={}", target, descriptor.modelRecommendation());
        return target;
    }

    private static void writeFile(Path target, byte[] bytes) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, bytes);
    }
}
