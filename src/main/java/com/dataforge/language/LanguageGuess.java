package com.dataforge.language;

public record LanguageGuess(String language, double confidence) {
    public static final String UNKNOWN = "unknown";

    public static LanguageGuess unknown() {
        return new LanguageGuess(UNKNOWN, 0.0);
    }

    public boolean isUnknown() {
        return UNKNOWN.equals(language);
    }
}
