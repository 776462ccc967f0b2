package com.purchasingpower.contextgraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class RetrievalProperties {

    /**
     * Matcher implementation: {@code keyword} (deterministic containment) or
     * {@code embedding} (cosine similarity against node embeddings).
     */
    @Pattern(regexp = "keyword|embedding")
    private String matcher = "keyword";

    @Min(1)
    private int defaultTopK = 20;

    /** Minimum cosine similarity for the embedding matcher. */
    private double minSimilarity = 0.5;
}
