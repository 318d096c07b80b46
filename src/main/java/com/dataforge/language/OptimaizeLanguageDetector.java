package com.dataforge.language;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.optimaize.langdetect.DetectedLanguage;
import com.optimaize.langdetect.LanguageDetectorBuilder;
import com.optimaize.langdetect.ngram.NgramExtractors;
import com.optimaize.langdetect.profiles.LanguageProfile;
import com.optimaize.langdetect.profiles.LanguageProfileReader;
import com.optimaize.langdetect.text.CommonTextObjectFactories;
import com.optimaize.langdetect.text.TextObject;
import com.optimaize.langdetect.text.TextObjectFactory;

/**
 * N-gram profile language detection over the built-in Optimaize profiles. The detector holds no random state, so
 * the same text always yields the same language.
 */
public class OptimaizeLanguageDetector implements LanguageDetector {
    private static final Logger log = LoggerFactory.getLogger(OptimaizeLanguageDetector.class);

    private final com.optimaize.langdetect.LanguageDetector delegate;
    private final TextObjectFactory textObjectFactory;

    private OptimaizeLanguageDetector(com.optimaize.langdetect.LanguageDetector delegate) {
        this.delegate = delegate;
        this.textObjectFactory = CommonTextObjectFactories.forDetectingOnLargeText();
    }

    public static LanguageDetector loadBuiltIn() {
        try {
            List<LanguageProfile> profiles = new LanguageProfileReader().readAllBuiltIn();
            com.optimaize.langdetect.LanguageDetector delegate = LanguageDetectorBuilder
                    .create(NgramExtractors.standard())
                    .withProfiles(profiles)
                    .build();
            log.info("language.profiles.loaded count={}", profiles.size());
            return new OptimaizeLanguageDetector(delegate);
        } catch (IOException | RuntimeException e) {
            log.warn("language.profiles.unavailable reason={}", e.getMessage());
            return new UnavailableLanguageDetector();
        }
    }

    public static LanguageDetector unavailable() {
        return new UnavailableLanguageDetector();
    }

    @Override
    public LanguageGuess detect(String text) {
        TextObject textObject = textObjectFactory.forText(text);
        List<DetectedLanguage> probabilities = delegate.getProbabilities(textObject);
        if (probabilities.isEmpty()) {
            return LanguageGuess.unknown();
        }
        DetectedLanguage best = probabilities.get(0);
        return new LanguageGuess(best.getLocale().getLanguage(), best.getProbability());
    }

    static final class UnavailableLanguageDetector implements LanguageDetector {
        @Override
        public LanguageGuess detect(String text) {
            return LanguageGuess.unknown();
        }

        @Override
        public boolean isAvailable() {
            return false;
        }
    }
}
