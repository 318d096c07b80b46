package com.dataforge.finetune;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Target representations for rendered examples. Chat-template formats render to strings, the rest to JSON-ready
 * maps.
 */
public enum OutputFormat {
    OPENAI {
        @Override
        public Object render(CanonicalExample example, String systemPrompt) {
            List<Map<String, Object>> messages = new ArrayList<>();
            if (!systemPrompt.isEmpty()) {
                messages.add(turn("role", "system", "content", systemPrompt));
            }
            messages.add(turn("role", "user", "content", example.userTurn()));
            messages.add(turn("role", "assistant", "content", example.output()));
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("messages", messages);
            return record;
        }
    },
    SHAREGPT {
        @Override
        public Object render(CanonicalExample example, String systemPrompt) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("conversations", List.of(
                    turn("from", "human", "value", example.userTurn()),
                    turn("from", "gpt", "value", example.output())));
            return record;
        }
    },
    ALPACA {
        @Override
        public Object render(CanonicalExample example, String systemPrompt) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("instruction", example.instruction());
            record.put("input", example.input());
            record.put("output", example.output());
            return record;
        }
    },
    LLAMA3 {
        @Override
        public Object render(CanonicalExample example, String systemPrompt) {
            String system = systemPrompt.isEmpty()
                    ? ""
                    : "<|start_header_id|>system<|end_header_id|>\n" + systemPrompt + "<|eot_id|>";
            return "<|begin_of_text|>" + system
                    + "<|start_header_id|>user<|end_header_id|>\n" + example.userTurn() + "<|eot_id|>"
                    + "<|start_header_id|>assistant<|end_header_id|>\n" + example.output() + "<|eot_id|>";
        }
    },
    LLAMA2 {
        @Override
        public Object render(CanonicalExample example, String systemPrompt) {
            String system = systemPrompt.isEmpty() ? "" : "<<SYS>>" + systemPrompt + "<</SYS>> ";
            return "<s>[INST] " + system + example.userTurn() + " [/INST] " + example.output() + " </s>";
        }
    },
    MISTRAL {
        @Override
        public Object render(CanonicalExample example, String systemPrompt) {
            String instruction = systemPrompt.isEmpty()
                    ? example.userTurn()
                    : (systemPrompt + "\n\n" + example.userTurn()).strip();
            return "<s>[INST] " + instruction + " [/INST] " + example.output() + "</s>";
        }
    },
    GEMMA {
        @Override
        public Object render(CanonicalExample example, String systemPrompt) {
            String opening = systemPrompt.isEmpty()
                    ? "<start_of_turn>user\n"
                    : "<start_of_turn>user\n" + systemPrompt + "\n\n";
            return opening + example.userTurn() + "<end_of_turn>\n<start_of_turn>model\n" + example.output()
                    + "<end_of_turn>";
        }
    };

    public abstract Object render(CanonicalExample example, String systemPrompt);

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Formats exported as a single JSON array instead of JSON Lines.
     */
    public boolean exportsAsJsonArray() {
        return this == ALPACA || this == SHAREGPT;
    }

    @JsonCreator
    public static OutputFormat fromId(String id) {
        if (id == null || id.isBlank()) {
            return OPENAI;
        }
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            String allowed = Arrays.stream(values()).map(OutputFormat::id).collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Unknown output format: " + id + ". Use one of " + allowed, e);
        }
    }

    private static Map<String, Object> turn(String roleKey, String role, String contentKey, String content) {
        Map<String, Object> turn = new LinkedHashMap<>();
        turn.put(roleKey, role);
        turn.put(contentKey, content);
        return turn;
    }
}
