package com.purchasingpower.contextgraph.model.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.AssessmentType;

/**
 * Gap identified by an assessment.
 *
 * @param identifiedBy id of the originating assessment
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Gap(
        String id,
        String description,
        String severity,
        AssessmentType type,
        @JsonProperty("identified_by") String identifiedBy
) implements Artifact {

    public Gap {
        description = description != null ? description : "";
        severity = severity != null && !severity.isBlank() ? severity : "medium";
    }

    @Override
    public ArtifactType artifactType() {
        return ArtifactType.GAP;
    }
}
