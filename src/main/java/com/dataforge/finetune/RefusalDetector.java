package com.dataforge.finetune;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Case-insensitive phrase matcher for canned assistant refusals.
 */
public class RefusalDetector {
    public static final List<String> DEFAULT_PHRASES = List.of(
            "I cannot",
            "I can not",
            "I'm unable",
            "I am unable",
            "As an AI",
            "As a language model",
            "I don't have the ability",
            "I am an AI",
            "I'm sorry, but",
            "I apologize, but",
            "is not appropriate");

    private final Pattern pattern;

    public RefusalDetector(List<String> phrases) {
        List<String> usable = phrases.stream().filter(phrase -> phrase != null && !phrase.isBlank()).toList();
        this.pattern = usable.isEmpty()
                ? null
                : Pattern.compile(usable.stream().map(Pattern::quote).collect(Collectors.joining("|")),
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public boolean isRefusal(String response) {
        if (response == null || pattern == null) {
            return false;
        }
        return pattern.matcher(response).find();
    }
}
