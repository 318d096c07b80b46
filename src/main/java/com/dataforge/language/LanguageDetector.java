package com.dataforge.language;

public interface LanguageDetector {
    LanguageGuess detect(String text);

    default boolean isAvailable() {
        return true;
    }
}
