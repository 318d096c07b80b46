package com.dataforge.pii;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import opennlp.tools.namefind.NameFinderME;
import opennlp.tools.namefind.TokenNameFinderModel;
import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.util.Span;

/**
 * Named-entity PII detection backed by OpenNLP name finder models. Each configured entity type maps to one model,
 * read from the classpath first and then from the file system. Missing models leave the detector unavailable.
 */
public class OpenNlpPiiDetector implements PiiDetector {
    private static final Logger log = LoggerFactory.getLogger(OpenNlpPiiDetector.class);

    private final Map<String, TokenNameFinderModel> models;
    private final String unavailableReason;

    OpenNlpPiiDetector(Map<String, TokenNameFinderModel> models, String unavailableReason) {
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        this.unavailableReason = unavailableReason;
    }

    public static OpenNlpPiiDetector load(Map<String, String> modelLocations) {
        Map<String, TokenNameFinderModel> loaded = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        modelLocations.forEach((entity, location) -> {
            try (InputStream in = open(location)) {
                if (in == null) {
                    missing.add(entity + " (" + location + ")");
                    return;
                }
                loaded.put(entity.toUpperCase(Locale.ROOT), new TokenNameFinderModel(in));
            } catch (IOException e) {
                log.warn("pii.ner.model.failed entity={} location={} reason={}", entity, location, e.getMessage());
                missing.add(entity + " (" + location + ")");
            }
        });
        String reason = "";
        if (loaded.isEmpty()) {
            reason = modelLocations.isEmpty() ? "no NER models configured" : "NER models not found: " + missing;
        }
        log.info("pii.ner.models loaded={} missing={}", loaded.keySet(), missing);
        return new OpenNlpPiiDetector(loaded, reason);
    }

    private static InputStream open(String location) throws IOException {
        InputStream resource = OpenNlpPiiDetector.class.getResourceAsStream(
                location.startsWith("/") ? location : "/" + location);
        if (resource != null) {
            return resource;
        }
        Path path = Path.of(location);
        return Files.isRegularFile(path) ? Files.newInputStream(path) : null;
    }

    @Override
    public List<PiiMatch> detect(String text, Set<String> entities) {
        if (text == null || text.isBlank() || models.isEmpty()) {
            return List.of();
        }
        Span[] tokenSpans = SimpleTokenizer.INSTANCE.tokenizePos(text);
        String[] tokens = Span.spansToStrings(tokenSpans, text);
        List<PiiMatch> matches = new ArrayList<>();
        models.forEach((entity, model) -> {
            if (!entities.contains(entity)) {
                return;
            }
            NameFinderME finder = new NameFinderME(model);
            for (Span span : finder.find(tokens)) {
                int start = tokenSpans[span.getStart()].getStart();
                int end = tokenSpans[span.getEnd() - 1].getEnd();
                matches.add(new PiiMatch(entity, start, end));
            }
        });
        return matches;
    }

    @Override
    public Set<String> supportedEntities() {
        return models.keySet();
    }

    @Override
    public boolean isAvailable() {
        return !models.isEmpty();
    }

    @Override
    public String unavailableReason() {
        return unavailableReason;
    }
}
