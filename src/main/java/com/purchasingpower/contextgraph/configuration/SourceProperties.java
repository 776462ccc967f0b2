package com.purchasingpower.contextgraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Locations of the external stores read during a sync pass. A missing file is an empty source.
 */
@Data
public class SourceProperties {

    @NotBlank
    private String roadmapFile = "output/master_roadmap.md";

    @NotBlank
    private String questionsFile = "data/questions/questions.json";

    @NotBlank
    private String decisionsFile = "data/questions/decisions.json";

    @NotBlank
    private String architectureAssessmentFile = "output/architecture-alignment.json";

    @NotBlank
    private String competitiveAssessmentsFile = "output/competitive/analyst_assessments.json";

    @NotBlank
    private String chunksFile = "data/chunks/roadmap_chunks.json";
}
