package com.dataforge.runtime;

import java.time.Duration;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataforge.embedding.EmbeddingService;
import com.dataforge.embedding.EmbeddingServices;
import com.dataforge.embedding.LocalModelEmbeddingService;
import com.dataforge.language.LanguageDetector;
import com.dataforge.language.OptimaizeLanguageDetector;
import com.dataforge.pii.OpenNlpPiiDetector;
import com.dataforge.pii.PiiDetector;
import com.dataforge.scoring.AiScoringService;
import com.dataforge.scoring.AiScoringServices;

import okhttp3.OkHttpClient;

/**
 * Optional capabilities handed to the steps. Every member is always present; a missing capability is represented
 * by an implementation whose {@code isAvailable()} returns false.
 */
public record StepServices(
        EmbeddingService embedding,
        PiiDetector nerDetector,
        LanguageDetector languageDetector,
        AiScoringService scoring) {

    private static final Logger log = LoggerFactory.getLogger(StepServices.class);

    public static StepServices fromConfig(AppConfig config) {
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(config.getScoring().getTimeoutMs()))
                .build();
        return fromConfig(config, httpClient);
    }

    public static StepServices fromConfig(AppConfig config, OkHttpClient httpClient) {
        EmbeddingService embedding = EmbeddingServices.fromConfig(config.getEmbedding(), httpClient);
        if (!embedding.isAvailable()) {
            log.warn("services.embedding.unavailable semanticDedup=disabled");
        }

        PiiDetector ner = config.getPii().isNerEnabled()
                ? OpenNlpPiiDetector.load(config.getPii().getNerModels())
                : OpenNlpPiiDetector.load(Map.of());
        if (!ner.isAvailable()) {
            log.warn("services.ner.unavailable reason=\"{}\" fallback=regex", ner.unavailableReason());
        }

        LanguageDetector languageDetector = config.getLanguage().isEnabled()
                ? OptimaizeLanguageDetector.loadBuiltIn()
                : OptimaizeLanguageDetector.unavailable();

        AiScoringService scoring = AiScoringServices.fromConfig(config.getScoring(), httpClient);
        if (!scoring.isAvailable()) {
            log.info("services.scoring.unavailable fallback=heuristic");
        }
        log.info("services.resolved embedding={} ner={} language={} scoring={}",
                embedding.version(), ner.isAvailable(), languageDetector.isAvailable(), scoring.isAvailable());
        return new StepServices(embedding, ner, languageDetector, scoring);
    }

    /**
     * Local-only services: hashing embeddings, built-in language profiles, regex-only PII and heuristic scoring.
     */
    public static StepServices offline() {
        return new StepServices(
                new LocalModelEmbeddingService(new AppConfig.EmbeddingConfig().getDimension()),
                OpenNlpPiiDetector.load(Map.of()),
                OptimaizeLanguageDetector.loadBuiltIn(),
                AiScoringServices.unavailable());
    }
}
