package com.purchasingpower.contextgraph.model.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.AssessmentType;

import java.util.Map;

/**
 * Architecture or competitive assessment.
 *
 * @param payload raw envelope as received from the assessment source
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Assessment(
        String id,
        AssessmentType type,
        String summary,
        @JsonProperty("data") Map<String, Object> payload
) implements Artifact {

    public Assessment {
        summary = summary != null ? summary : "";
        payload = payload != null ? payload : Map.of();
    }

    @Override
    public ArtifactType artifactType() {
        return ArtifactType.ASSESSMENT;
    }
}
