package com.dataforge.pipeline.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scores text 0-10 from five weighted signals: length, vocabulary diversity, sentence repetition, alphabetic
 * ratio and capitalization.
 */
public final class HeuristicQualityScorer {
    private static final double[] WEIGHTS = { 1.5, 2.0, 2.0, 1.0, 0.5 };
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public Score score(String text) {
        if (text == null || text.isBlank()) {
            return new Score(0.0, "Empty text");
        }
        List<String> reasons = new ArrayList<>();
        double[] subScores = {
            lengthScore(text, reasons),
            vocabularyScore(text, reasons),
            repetitionScore(text, reasons),
            alphabeticScore(text, reasons),
            capitalizationScore(text, reasons)
        };

        double weighted = 0.0;
        for (int i = 0; i < subScores.length; i++) {
            weighted += subScores[i] * WEIGHTS[i];
        }
        double total = Arrays.stream(WEIGHTS).sum();
        double clamped = Math.min(10.0, Math.max(0.0, weighted / total));
        String reason = reasons.isEmpty() ? "Good quality" : String.join("; ", reasons);
        return new Score(Math.round(clamped * 100.0) / 100.0, reason);
    }

    private static double lengthScore(String text, List<String> reasons) {
        int length = text.length();
        if (length < 10) {
            reasons.add("Very short");
            return 1.0;
        }
        if (length < 50) {
            reasons.add("Short");
            return 4.0;
        }
        if (length <= 5000) {
            return 10.0;
        }
        if (length <= 20000) {
            reasons.add("Long");
            return 7.0;
        }
        reasons.add("Very long");
        return 4.0;
    }

    private static double vocabularyScore(String text, List<String> reasons) {
        String[] words = WHITESPACE.split(text.toLowerCase(Locale.ROOT).strip());
        if (words.length == 0 || words[0].isEmpty()) {
            return 1.0;
        }
        double uniqueRatio = (double) new HashSet<>(Arrays.asList(words)).size() / words.length;
        if (uniqueRatio < 0.3) {
            reasons.add("Low vocabulary diversity");
        }
        return Math.min(10.0, uniqueRatio * 12);
    }

    private static double repetitionScore(String text, List<String> reasons) {
        Map<String, Integer> counts = new HashMap<>();
        int sentences = 0;
        for (String sentence : SENTENCE_END.split(text)) {
            String normalized = sentence.strip().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty()) {
                counts.merge(normalized, 1, Integer::sum);
                sentences++;
            }
        }
        if (sentences <= 1) {
            return 7.0;
        }
        int maxRepeat = counts.values().stream().mapToInt(Integer::intValue).max().orElse(1);
        if (maxRepeat > 2) {
            reasons.add("Repeated sentences (" + maxRepeat + "x)");
            return Math.max(1.0, 10.0 - (maxRepeat - 1) * 2);
        }
        return 10.0;
    }

    private static double alphabeticScore(String text, List<String> reasons) {
        double alphaRatio = (double) countLetters(text) / text.length();
        if (alphaRatio > 0.6) {
            return 10.0;
        }
        if (alphaRatio > 0.4) {
            return 7.0;
        }
        reasons.add("High special char ratio");
        return 3.0;
    }

    private static double capitalizationScore(String text, List<String> reasons) {
        long letters = countLetters(text);
        if (letters == 0) {
            return 5.0;
        }
        long upper = text.chars().filter(Character::isUpperCase).count();
        double upperRatio = (double) upper / letters;
        if (upperRatio >= 0.02 && upperRatio <= 0.15) {
            return 10.0;
        }
        if (upperRatio > 0.5) {
            reasons.add("Excessive caps");
            return 3.0;
        }
        return 7.0;
    }

    private static long countLetters(String text) {
        return text.chars().filter(Character::isLetter).count();
    }

    public record Score(double score, String reason) {
    }
}
