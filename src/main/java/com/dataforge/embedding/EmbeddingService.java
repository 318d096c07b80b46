package com.dataforge.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public interface EmbeddingService {
    float[] embed(String text) throws IOException;

    /**
     * Embeds every text with this service. Either all vectors come back from the same model or the call fails, so
     * callers never compare vectors from different embedding spaces.
     */
    default List<float[]> embedAll(List<String> texts) throws IOException {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    int dimension();

    default String version() {
        return "local-v1";
    }

    default boolean isAvailable() {
        return true;
    }
}
