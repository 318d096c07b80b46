package com.dataforge.embedding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * In-memory cosine similarity index over row embeddings. Rows are addressed by their insertion position.
 */
public class NearestNeighborIndex {
    private final List<float[]> vectors = new ArrayList<>();

    public static NearestNeighborIndex of(List<float[]> embeddings) {
        NearestNeighborIndex index = new NearestNeighborIndex();
        embeddings.forEach(index::add);
        return index;
    }

    public int add(float[] embedding) {
        vectors.add(embedding);
        return vectors.size() - 1;
    }

    public int size() {
        return vectors.size();
    }

    public List<Neighbor> search(float[] query, int topK) {
        List<Neighbor> neighbors = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            neighbors.add(new Neighbor(i, cosine(query, vectors.get(i))));
        }
        return neighbors.stream()
                .sorted(Comparator.comparing(Neighbor::score).reversed().thenComparing(Neighbor::index))
                .limit(Math.max(0, topK))
                .toList();
    }

    static float cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Cannot compare embeddings of dimension " + a.length + " and "
                    + b.length);
        }
        float dot = 0f;
        float aNorm = 0f;
        float bNorm = 0f;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0f || bNorm == 0f) {
            return 0f;
        }
        return (float) (dot / Math.sqrt(aNorm * bNorm));
    }

    public record Neighbor(int index, float score) {
    }
}
