package com.purchasingpower.contextgraph.model.retrieval;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.contextgraph.model.artifact.Artifact;

/**
 * One retrieval hit.
 *
 * @param similarity match score, fixed per category for keyword matching
 * @param supersededBy id of the decision overriding this chunk, null otherwise
 */
public record RetrievedArtifact(
        String id,
        Artifact data,
        double similarity,
        @JsonProperty("superseded_by") @JsonInclude(JsonInclude.Include.NON_NULL) String supersededBy
) {

    public RetrievedArtifact(String id, Artifact data, double similarity) {
        this(id, data, similarity, null);
    }

    public RetrievedArtifact withSupersededBy(String decisionId) {
        return new RetrievedArtifact(id, data, similarity, decisionId);
    }
}
