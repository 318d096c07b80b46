package com.dataforge.scoring;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits texts into batches and scores them on a bounded pool, pausing between batch submissions. Rate-limit
 * failures retry with exponential backoff; any other failure, or exhausted retries, degrade that batch to the
 * fallback scorer.
 */
public class BatchedAiScorer {
    private static final Logger log = LoggerFactory.getLogger(BatchedAiScorer.class);

    private final AiScoringService service;
    private final int batchSize;
    private final long batchDelayMs;
    private final int maxRetries;
    private final int concurrency;

    public BatchedAiScorer(AiScoringService service, int batchSize, long batchDelayMs, int maxRetries, int concurrency) {
        this.service = service;
        this.batchSize = Math.max(1, batchSize);
        this.batchDelayMs = Math.max(0, batchDelayMs);
        this.maxRetries = Math.max(1, maxRetries);
        this.concurrency = Math.max(1, concurrency);
    }

    public Outcome score(List<String> texts, Function<String, AiScore> fallback) {
        List<List<String>> batches = new ArrayList<>();
        for (int start = 0; start < texts.size(); start += batchSize) {
            batches.add(texts.subList(start, Math.min(texts.size(), start + batchSize)));
        }

        ExecutorService executor = Executors.newFixedThreadPool(concurrency);
        List<Future<BatchOutcome>> futures = new ArrayList<>(batches.size());
        try {
            for (int i = 0; i < batches.size(); i++) {
                List<String> batch = batches.get(i);
                int batchIndex = i;
                futures.add(executor.submit(() -> scoreBatch(batchIndex, batch, fallback)));
                if (i < batches.size() - 1 && batchDelayMs > 0) {
                    Thread.sleep(batchDelayMs);
                }
            }

            List<AiScore> scores = new ArrayList<>(texts.size());
            List<String> warnings = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                BatchOutcome outcome = await(futures.get(i), batches.get(i), fallback);
                scores.addAll(outcome.scores());
                outcome.warning().ifPresent(warnings::add);
            }
            return new Outcome(scores, warnings);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("scoring.ai.interrupted batches={}", batches.size());
            return new Outcome(fallbackAll(texts, fallback), List.of("AI scoring interrupted - using heuristic fallback."));
        } finally {
            executor.shutdownNow();
        }
    }

    private BatchOutcome await(Future<BatchOutcome> future, List<String> batch, Function<String, AiScore> fallback)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.warn("scoring.ai.batch.crashed reason={}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return new BatchOutcome(fallbackAll(batch, fallback),
                    Optional.of("AI scoring failed for batch: " + e.getCause()));
        }
    }

    private BatchOutcome scoreBatch(int batchIndex, List<String> batch, Function<String, AiScore> fallback)
            throws InterruptedException {
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                List<AiScore> scores = service.scoreBatch(batch);
                return new BatchOutcome(alignToBatch(scores, batch, fallback), Optional.empty());
            } catch (RateLimitedException e) {
                long backoff = batchDelayMs * (1L << attempt);
                log.warn("scoring.ai.rate_limited batch={} attempt={} maxAttempts={} backoffMs={}",
                        batchIndex, attempt + 1, maxRetries, backoff);
                if (attempt < maxRetries - 1) {
                    Thread.sleep(backoff);
                }
            } catch (IOException | RuntimeException e) {
                log.warn("scoring.ai.batch.failed batch={} reason={}", batchIndex, e.getMessage());
                return new BatchOutcome(fallbackAll(batch, fallback),
                        Optional.of("AI scoring failed for batch: " + e.getMessage()));
            }
        }
        return new BatchOutcome(fallbackAll(batch, fallback),
                Optional.of("AI scoring failed after max retries - using heuristic fallback."));
    }

    private static List<AiScore> alignToBatch(List<AiScore> scores, List<String> batch, Function<String, AiScore> fallback) {
        List<AiScore> aligned = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            aligned.add(i < scores.size() ? scores.get(i) : fallbackFor(batch.get(i), fallback));
        }
        return aligned;
    }

    private static List<AiScore> fallbackAll(List<String> texts, Function<String, AiScore> fallback) {
        List<AiScore> scores = new ArrayList<>(texts.size());
        for (String text : texts) {
            scores.add(fallbackFor(text, fallback));
        }
        return scores;
    }

    private static AiScore fallbackFor(String text, Function<String, AiScore> fallback) {
        AiScore heuristic = fallback.apply(text);
        return new AiScore(heuristic.score(), "(fallback) " + heuristic.reason());
    }

    public record Outcome(List<AiScore> scores, List<String> warnings) {
    }

    private record BatchOutcome(List<AiScore> scores, Optional<String> warning) {
    }
}
