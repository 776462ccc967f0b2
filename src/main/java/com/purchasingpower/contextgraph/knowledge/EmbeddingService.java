package com.purchasingpower.contextgraph.knowledge;

import java.util.List;

/**
 * Embedding collaborator used while integrating decisions and roadmap items, and by the
 * embedding-based retrieval matcher.
 *
 * <p>Calls are batched: one list of texts in, one list of vectors out, same order.
 *
 * @since 1.0.0
 */
public interface EmbeddingService {

    /**
     * Generate embeddings for several texts in one round trip.
     *
     * @param texts texts to embed, none blank
     * @return one vector per input text, same order as input
     */
    List<List<Double>> embedAll(List<String> texts);

    /**
     * Generate an embedding for a single text (useful for search queries).
     */
    default List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text cannot be empty");
        }
        return embedAll(List.of(text)).get(0);
    }
}
