package com.purchasingpower.contextgraph.source;

import java.time.Instant;
import java.util.Optional;

/**
 * Supplies the current roadmap text.
 */
public interface RoadmapSource {

    /**
     * @return roadmap markdown, empty if no roadmap has been produced yet
     */
    Optional<String> readRoadmap();

    default Optional<Instant> lastModified() {
        return Optional.empty();
    }
}
