package com.dataforge.scoring;

import java.io.IOException;
import java.util.List;

public interface AiScoringService {
    /**
     * Scores each text 0-10. Throws {@link RateLimitedException} when the provider asks the caller to slow down.
     */
    List<AiScore> scoreBatch(List<String> texts) throws IOException;

    default boolean isAvailable() {
        return true;
    }
}
