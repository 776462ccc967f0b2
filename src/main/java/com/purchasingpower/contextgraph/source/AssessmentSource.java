package com.purchasingpower.contextgraph.source;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Supplies raw assessment envelopes. Gaps are read from {@code analysis.roadmap_gaps}.
 */
public interface AssessmentSource {

    /**
     * @return the architecture alignment payload, empty if none was produced
     */
    Optional<Map<String, Object>> loadArchitectureAssessment();

    List<Map<String, Object>> loadCompetitiveAssessments();

    default Optional<Instant> lastModified() {
        return Optional.empty();
    }
}
