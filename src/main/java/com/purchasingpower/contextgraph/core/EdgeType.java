package com.purchasingpower.contextgraph.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Typed relationships between artifacts.
 *
 * <p>Structural edges carry a fixed weight; semantic edges are weighted by the cosine
 * similarity that produced them and are recomputed on every sync pass.
 *
 * @since 1.0.0
 */
public enum EdgeType {
    /** decision → question */
    RESOLVES(1.0),
    /** decision → roadmap item */
    IMPACTS(1.0),
    /** assessment → gap */
    IDENTIFIES_GAP(0.9),
    /** question → roadmap item */
    ABOUT_ITEM(0.8),
    /** roadmap item → chunk, high similarity */
    SUPPORTED_BY(0.0),
    /** roadmap item → chunk, moderate similarity */
    MENTIONED_IN(0.0),
    /** decision → chunk; the decision takes precedence over the chunk's claim */
    OVERRIDES(0.0);

    /** Edges owned by the inferencer, cleared and recomputed on every pass. */
    public static final Set<EdgeType> SEMANTIC =
            Collections.unmodifiableSet(EnumSet.of(SUPPORTED_BY, MENTIONED_IN, OVERRIDES));

    private final double defaultWeight;

    EdgeType(double defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }
}
