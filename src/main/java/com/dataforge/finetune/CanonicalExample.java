package com.dataforge.finetune;

/**
 * Instruction/input/output triple every supported input schema is normalized into. Fields are never null.
 */
public record CanonicalExample(String instruction, String input, String output) {
    public static final CanonicalExample EMPTY = new CanonicalExample("", "", "");

    public CanonicalExample {
        instruction = instruction == null ? "" : instruction;
        input = input == null ? "" : input;
        output = output == null ? "" : output;
    }

    public String userTurn() {
        return input.isEmpty() ? instruction : (instruction + "\n" + input).strip();
    }
}
