package com.purchasingpower.contextgraph.model.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.DecisionStatus;

import java.util.List;

/**
 * Recorded decision. Highest authority in the graph.
 *
 * @param statement the decision text
 * @param questionId id of the question this decision resolves, may be null
 * @param relatedRoadmapItems roadmap item names the decision impacts
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Decision(
        String id,
        @JsonProperty("decision") String statement,
        String rationale,
        List<String> implications,
        String owner,
        DecisionStatus status,
        @JsonProperty("question_id") String questionId,
        @JsonProperty("related_roadmap_items") List<String> relatedRoadmapItems,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt
) implements Artifact {

    public Decision {
        statement = statement != null ? statement : "";
        rationale = rationale != null ? rationale : "";
        implications = implications != null ? List.copyOf(implications) : List.of();
        status = status != null ? status : DecisionStatus.ACTIVE;
        relatedRoadmapItems = relatedRoadmapItems != null ? List.copyOf(relatedRoadmapItems) : List.of();
    }

    @Override
    public ArtifactType artifactType() {
        return ArtifactType.DECISION;
    }

    /**
     * Text sent to the embedding service: statement and rationale joined.
     */
    public String embeddingText() {
        return statement + ". " + rationale;
    }

    public boolean hasEmbeddableText() {
        return !statement.isBlank() || !rationale.isBlank();
    }
}
