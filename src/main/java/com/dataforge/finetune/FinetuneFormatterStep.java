package com.dataforge.finetune;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.dataset.Dataset;
import com.dataforge.pipeline.ConfigReader;
import com.dataforge.pipeline.PipelineStep;
import com.dataforge.pipeline.StepResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Normalizes heterogeneous instruction datasets into {@link CanonicalExample}s, renders them into the target
 * format and drops examples above the token ceiling.
 */
public class FinetuneFormatterStep implements PipelineStep {
    public static final String NAME = "finetune_formatter";
    public static final String NORM_INSTRUCTION = "_norm_instruction";
    public static final String NORM_INPUT = "_norm_input";
    public static final String NORM_OUTPUT = "_norm_output";
    public static final String FORMATTED_TEXT = "formatted_text";
    public static final String TOKEN_COUNT = "token_count";
    public static final List<String> CANONICAL_COLUMNS = List.of(NORM_INSTRUCTION, NORM_INPUT, NORM_OUTPUT);

    private static final Logger log = LoggerFactory.getLogger(FinetuneFormatterStep.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    record Settings(
            InputFormat inputFormat,
            OutputFormat outputFormat,
            String systemPrompt,
            int maxTokensPerExample,
            String tokenizer,
            String instructionColumn,
            String inputColumn,
            String outputColumn) {

        static Settings from(Map<String, Object> config) {
            ConfigReader reader = ConfigReader.of(NAME, config);
            return new Settings(
                    reader.choice("input_format", InputFormat.AUTO, InputFormat.class),
                    reader.choice("output_format", OutputFormat.OPENAI, OutputFormat.class),
                    reader.string("system_prompt", ""),
                    reader.integer("max_tokens_per_example", 4096),
                    reader.string("tokenizer", TokenCounter.DEFAULT_ENCODING),
                    reader.string("instruction_column", "auto"),
                    reader.string("input_column", "auto"),
                    reader.string("output_column", "auto"));
        }
    }

    record Detection(InputFormat format, String warning) {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Normalize formats to target LLM prompts and filter by token limits";
    }

    @Override
    public void validateConfig(Map<String, Object> config) {
        Settings.from(config);
    }

    @Override
    public StepResult run(Dataset dataset, Map<String, Object> config) {
        Settings settings = Settings.from(config);
        int rowsBefore = dataset.rowCount();
        List<String> warnings = new ArrayList<>();

        Detection detection = settings.inputFormat() == InputFormat.AUTO
                ? detect(dataset)
                : new Detection(settings.inputFormat(), null);
        if (detection.warning() != null) {
            warnings.add(detection.warning());
        }
        log.info("finetune.format.detected requested={} resolved={} output={}",
                settings.inputFormat().id(), detection.format().id(), settings.outputFormat().id());

        TokenCounter counter = TokenCounter.named(settings.tokenizer()).orElseGet(() -> {
            warnings.add("Tokenizer " + settings.tokenizer() + " not found, falling back to "
                    + TokenCounter.DEFAULT_ENCODING + ".");
            return TokenCounter.defaultCounter();
        });

        List<CanonicalExample> examples = normalize(dataset, detection.format(), settings);
        List<Object> instructions = new ArrayList<>(rowsBefore);
        List<Object> inputs = new ArrayList<>(rowsBefore);
        List<Object> outputs = new ArrayList<>(rowsBefore);
        List<Object> rendered = new ArrayList<>(rowsBefore);
        List<Object> tokenCounts = new ArrayList<>(rowsBefore);
        for (CanonicalExample example : examples) {
            Object formatted = settings.outputFormat().render(example, settings.systemPrompt());
            instructions.add(example.instruction());
            inputs.add(example.input());
            outputs.add(example.output());
            rendered.add(formatted);
            tokenCounts.add(counter.count(tokenizable(formatted)));
        }

        Dataset formatted = dataset
                .withColumn(NORM_INSTRUCTION, instructions)
                .withColumn(NORM_INPUT, inputs)
                .withColumn(NORM_OUTPUT, outputs)
                .withColumn(FORMATTED_TEXT, rendered)
                .withColumn(TOKEN_COUNT, tokenCounts);
        Dataset kept = formatted.filterRows(row -> (Integer) tokenCounts.get(row) <= settings.maxTokensPerExample());
        int filteredOut = rowsBefore - kept.rowCount();

        List<Integer> keptCounts = new ArrayList<>(kept.rowCount());
        kept.column(TOKEN_COUNT).forEach(value -> keptCounts.add((Integer) value));
        log.info("finetune.format.completed examples={} filteredTokenLimit={} tokenizer={}",
                kept.rowCount(), filteredOut, counter.encodingName());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("input_format_detected", detection.format().id());
        metadata.put("output_format", settings.outputFormat().id());
        metadata.put("examples_formatted", kept.rowCount());
        metadata.put("examples_filtered_token_limit", filteredOut);
        metadata.put("avg_token_count", round(keptCounts.stream().mapToInt(Integer::intValue).average().orElse(0.0)));
        metadata.put("max_token_count", keptCounts.stream().mapToInt(Integer::intValue).max().orElse(0));
        metadata.put("min_token_count", keptCounts.stream().mapToInt(Integer::intValue).min().orElse(0));
        metadata.put("token_distribution", tokenDistribution(keptCounts));
        return StepResult.of(rowsBefore, kept, metadata, warnings);
    }

    static Detection detect(Dataset dataset) {
        InputFormat format;
        if (has(dataset, "messages") || has(dataset, "conversations")) {
            format = InputFormat.SHAREGPT;
        } else if (has(dataset, "instruction") && has(dataset, "output")) {
            format = InputFormat.ALPACA;
        } else if ((has(dataset, "question") && has(dataset, "answer")) || (has(dataset, "q") && has(dataset, "a"))) {
            format = InputFormat.QA_PAIRS;
        } else if (has(dataset, "prompt") && has(dataset, "completion")) {
            format = InputFormat.RAW_PAIRS;
        } else {
            return new Detection(InputFormat.RAW_PAIRS, "Could not confidently auto-detect input format. "
                    + "Falling back to 'raw_pairs' taking first two text columns.");
        }
        return new Detection(format, null);
    }

    private List<CanonicalExample> normalize(Dataset dataset, InputFormat format, Settings settings) {
        List<String> columns = dataset.columnNames();
        String first = columns.isEmpty() ? null : columns.get(0);
        String last = columns.isEmpty() ? null : columns.get(columns.size() - 1);
        List<CanonicalExample> examples = new ArrayList<>(dataset.rowCount());

        if (format == InputFormat.SHAREGPT) {
            String turns = column(dataset, "messages").or(() -> column(dataset, "conversations")).orElse(first);
            for (int row = 0; row < dataset.rowCount(); row++) {
                examples.add(turns == null ? CanonicalExample.EMPTY : fromConversation(dataset.value(row, turns)));
            }
            return examples;
        }

        String instruction;
        String input = null;
        String output;
        switch (format) {
            case ALPACA -> {
                instruction = column(dataset, "instruction").orElse(null);
                input = column(dataset, "input").orElse(null);
                output = column(dataset, "output").orElse(null);
            }
            case QA_PAIRS -> {
                instruction = column(dataset, "question").or(() -> column(dataset, "q")).orElse(first);
                output = column(dataset, "answer").or(() -> column(dataset, "a")).orElse(last);
            }
            case RAW_PAIRS -> {
                instruction = column(dataset, "prompt").orElse(first);
                output = column(dataset, "completion").orElse(columns.size() > 1 ? columns.get(1) : first);
            }
            default -> {
                instruction = dataset.hasColumn(settings.instructionColumn()) ? settings.instructionColumn() : null;
                input = dataset.hasColumn(settings.inputColumn()) ? settings.inputColumn() : null;
                output = dataset.hasColumn(settings.outputColumn()) ? settings.outputColumn() : null;
            }
        }
        for (int row = 0; row < dataset.rowCount(); row++) {
            examples.add(new CanonicalExample(
                    cell(dataset, row, instruction),
                    cell(dataset, row, input),
                    cell(dataset, row, output)));
        }
        return examples;
    }

    static CanonicalExample fromConversation(Object value) {
        List<?> turns;
        if (value instanceof List<?> list) {
            turns = list;
        } else if (value instanceof String text) {
            try {
                turns = MAPPER.readValue(text, new TypeReference<List<Object>>() {
                });
            } catch (JsonProcessingException e) {
                log.debug("finetune.format.conversation.unparseable reason={}", e.getOriginalMessage());
                return CanonicalExample.EMPTY;
            }
        } else {
            return CanonicalExample.EMPTY;
        }
        if (turns == null || turns.size() < 2) {
            return CanonicalExample.EMPTY;
        }
        String instruction = firstTurn(turns, "user", "human");
        String output = firstTurn(turns, "assistant", "gpt");
        return new CanonicalExample(instruction, "", output);
    }

    private static String firstTurn(List<?> turns, String role, String speaker) {
        for (Object turn : turns) {
            if (turn instanceof Map<?, ?> message
                    && (role.equals(message.get("role")) || speaker.equals(message.get("from")))) {
                Object content = message.get("content") != null ? message.get("content") : message.get("value");
                return content == null ? "" : String.valueOf(content);
            }
        }
        return "";
    }

    private static String tokenizable(Object formatted) {
        if (formatted instanceof String text) {
            return text;
        }
        try {
            return MAPPER.writeValueAsString(formatted);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Rendered example is not serializable", e);
        }
    }

    private static Map<String, Integer> tokenDistribution(List<Integer> counts) {
        Map<String, Integer> buckets = new LinkedHashMap<>();
        for (String bucket : List.of("0-512", "512-1024", "1024-2048", "2048-4096", "4096+")) {
            buckets.put(bucket, 0);
        }
        for (int count : counts) {
            String bucket = count <= 512 ? "0-512"
                    : count <= 1024 ? "512-1024"
                    : count <= 2048 ? "1024-2048"
                    : count <= 4096 ? "2048-4096"
                    : "4096+";
            buckets.merge(bucket, 1, Integer::sum);
        }
        return buckets;
    }

    private static boolean has(Dataset dataset, String name) {
        return dataset.findColumnIgnoreCase(name).isPresent();
    }

    private static Optional<String> column(Dataset dataset, String name) {
        return dataset.findColumnIgnoreCase(name);
    }

    private static String cell(Dataset dataset, int row, String column) {
        return column == null ? "" : dataset.text(row, column);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
