package com.dataforge.scoring;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AiScore(double score, String reason) {
    public AiScore {
        score = Math.min(10.0, Math.max(0.0, score));
        reason = reason == null ? "" : reason;
    }
}
