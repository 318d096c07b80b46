package com.dataforge.pii;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class RegexPiiDetector implements PiiDetector {
    private static final Map<String, Pattern> PATTERNS = patterns();

    @Override
    public List<PiiMatch> detect(String text, Set<String> entities) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<PiiMatch> matches = new ArrayList<>();
        PATTERNS.forEach((entity, pattern) -> {
            if (!entities.contains(entity)) {
                return;
            }
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                if (matcher.end() > matcher.start()) {
                    matches.add(new PiiMatch(entity, matcher.start(), matcher.end()));
                }
            }
        });
        return matches;
    }

    @Override
    public Set<String> supportedEntities() {
        return PATTERNS.keySet();
    }

    private static Map<String, Pattern> patterns() {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put("EMAIL", compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"));
        patterns.put("PHONE", compile("(?:\\+?1[-.\\s]?)?\\(?[2-9]\\d{2}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}"));
        patterns.put("SSN", compile("\\b\\d{3}-?\\d{2}-?\\d{4}\\b"));
        patterns.put("CREDIT_CARD", compile("\\b(?:\\d{4}[-\\s]?){3}\\d{4}\\b"));
        patterns.put("IP_ADDRESS", compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b"));
        patterns.put("URL", compile("https?://[^\\s<>\"']+|www\\.[^\\s<>\"']+"));
        return Collections.unmodifiableMap(patterns);
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
