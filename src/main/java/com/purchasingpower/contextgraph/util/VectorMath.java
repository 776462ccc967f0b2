package com.purchasingpower.contextgraph.util;

import java.util.List;

/**
 * Vector helpers for embedding comparison.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity of two vectors of equal dimension.
     *
     * @return similarity in [-1, 1]; 0.0 when either vector has zero norm
     * @throws IllegalArgumentException if the dimensions differ
     */
    public static double cosineSimilarity(List<Double> a, List<Double> b) {
        if (a.size() != b.size()) {
            throw new IllegalArgumentException("Vector dimensions differ: " + a.size() + " vs " + b.size());
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
