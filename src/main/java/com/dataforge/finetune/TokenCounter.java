package com.dataforge.finetune;

import java.util.Optional;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * BPE token counting backed by JTokkit encodings.
 */
public final class TokenCounter {
    public static final String DEFAULT_ENCODING = "cl100k_base";
    private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

    private final Encoding encoding;

    private TokenCounter(Encoding encoding) {
        this.encoding = encoding;
    }

    public static TokenCounter defaultCounter() {
        return new TokenCounter(REGISTRY.getEncoding(EncodingType.CL100K_BASE));
    }

    public static Optional<TokenCounter> named(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return REGISTRY.getEncoding(name.trim()).map(TokenCounter::new);
    }

    public String encodingName() {
        return encoding.getName();
    }

    public int count(String text) {
        return text == null || text.isEmpty() ? 0 : encoding.countTokens(text);
    }
}
