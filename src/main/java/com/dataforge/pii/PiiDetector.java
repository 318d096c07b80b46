package com.dataforge.pii;

import java.util.List;
import java.util.Set;

public interface PiiDetector {
    /**
     * Finds entity spans in {@code text}, restricted to {@code entities} (upper-case type names).
     */
    List<PiiMatch> detect(String text, Set<String> entities);

    Set<String> supportedEntities();

    default boolean isAvailable() {
        return true;
    }

    default String unavailableReason() {
        return "";
    }
}
