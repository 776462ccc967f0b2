package com.purchasingpower.contextgraph.knowledge;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Embedding service returning preset vectors per text prefix; records every batch call.
 */
public class FakeEmbeddingService implements EmbeddingService {

    private final Map<String, List<Double>> vectorsByPrefix = new HashMap<>();
    private final List<List<String>> batches = new ArrayList<>();
    private List<Double> defaultVector = List.of(0.0, 1.0);

    public FakeEmbeddingService vector(String textPrefix, List<Double> vector) {
        vectorsByPrefix.put(textPrefix, vector);
        return this;
    }

    public FakeEmbeddingService defaultVector(List<Double> vector) {
        this.defaultVector = vector;
        return this;
    }

    @Override
    public List<List<Double>> embedAll(List<String> texts) {
        batches.add(List.copyOf(texts));
        List<List<Double>> vectors = new ArrayList<>();
        for (String text : texts) {
            vectors.add(vectorsByPrefix.entrySet().stream()
                    .filter(e -> text.startsWith(e.getKey()))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(defaultVector));
        }
        return vectors;
    }

    public List<List<String>> batches() {
        return batches;
    }
}
