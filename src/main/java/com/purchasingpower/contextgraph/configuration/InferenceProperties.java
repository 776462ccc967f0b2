package com.purchasingpower.contextgraph.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

/**
 * Cosine similarity thresholds for semantic edge inference.
 */
@Data
public class InferenceProperties {

    /** roadmap item ↔ chunk, high relevance */
    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double supportedByThreshold = 0.75;

    /** roadmap item ↔ chunk, moderate relevance; must stay below supported-by */
    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double mentionedInThreshold = 0.65;

    /** decision ↔ chunk */
    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double overridesThreshold = 0.70;
}
