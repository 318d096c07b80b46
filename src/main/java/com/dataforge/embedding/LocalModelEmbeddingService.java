package com.dataforge.embedding;

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Offline embedding for near-duplicate detection. Rows are reduced to word and character shingles, each shingle
 * is folded into a fixed number of buckets with a signed hash, and counts are damped logarithmically so long rows
 * do not dominate. Rewordings that share most of their shingles land close together under cosine similarity.
 */
public class LocalModelEmbeddingService implements EmbeddingService {
    static final String VERSION = "local-shingle-v2";
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int CHAR_SHINGLE = 4;
    private static final float WORD_WEIGHT = 1.0f;
    private static final float WORD_PAIR_WEIGHT = 0.6f;
    private static final float CHAR_WEIGHT = 0.3f;
    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final int dimension;

    public LocalModelEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        String canonical = canonical(text);
        if (canonical.isEmpty()) {
            return vector;
        }

        Map<String, Integer> shingles = new HashMap<>();
        String[] words = canonical.split(" ");
        for (int w = 0; w < words.length; w++) {
            shingles.merge("w|" + words[w], 1, Integer::sum);
            if (w > 0) {
                shingles.merge("p|" + words[w - 1] + ' ' + words[w], 1, Integer::sum);
            }
        }
        String padded = ' ' + canonical + ' ';
        for (int i = 0; i + CHAR_SHINGLE <= padded.length(); i++) {
            shingles.merge("c|" + padded.substring(i, i + CHAR_SHINGLE), 1, Integer::sum);
        }

        shingles.forEach((shingle, count) -> {
            long hash = fnv1a(shingle);
            int bucket = (int) Long.remainderUnsigned(hash, dimension);
            float sign = (hash >>> 63) == 0 ? 1f : -1f;
            vector[bucket] += sign * weight(shingle) * (float) (1.0 + Math.log(count));
        });
        return unitLength(vector);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return VERSION;
    }

    /** Lowercased, accent-folded words separated by single spaces. */
    static String canonical(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String folded = Normalizer.normalize(text, Normalizer.Form.NFKD).replaceAll("\\p{M}+", "");
        return NON_WORD.matcher(folded.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
    }

    private static float weight(String shingle) {
        return switch (shingle.charAt(0)) {
            case 'w' -> WORD_WEIGHT;
            case 'p' -> WORD_PAIR_WEIGHT;
            default -> CHAR_WEIGHT;
        };
    }

    private static long fnv1a(String value) {
        long hash = FNV_OFFSET;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xff;
            hash *= FNV_PRIME;
        }
        return hash;
    }

    private static float[] unitLength(float[] vector) {
        double squares = 0.0;
        for (float value : vector) {
            squares += (double) value * value;
        }
        if (squares == 0.0) {
            return vector;
        }
        float scale = (float) (1.0 / Math.sqrt(squares));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
        return vector;
    }
}
