package com.purchasingpower.contextgraph.model.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.QuestionStatus;

import java.util.List;

/**
 * Open or answered question. Authority depends on {@link #status()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Question(
        String id,
        @JsonProperty("question") String text,
        String audience,
        String category,
        String priority,
        QuestionStatus status,
        @JsonProperty("related_roadmap_items") List<String> relatedRoadmapItems,
        String answer,
        @JsonProperty("answered_by_decision") String answeredByDecision
) implements Artifact {

    public Question {
        text = text != null ? text : "";
        status = status != null ? status : QuestionStatus.PENDING;
        relatedRoadmapItems = relatedRoadmapItems != null ? List.copyOf(relatedRoadmapItems) : List.of();
    }

    @Override
    public ArtifactType artifactType() {
        return ArtifactType.QUESTION;
    }

    /**
     * Copy of this question marked as answered by the given decision.
     */
    public Question answeredBy(String decisionId) {
        return new Question(id, text, audience, category, priority, QuestionStatus.ANSWERED,
                relatedRoadmapItems, answer, decisionId);
    }
}
