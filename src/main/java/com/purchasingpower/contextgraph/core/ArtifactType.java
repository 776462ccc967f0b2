package com.purchasingpower.contextgraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.contextgraph.model.artifact.Artifact;
import com.purchasingpower.contextgraph.model.artifact.Assessment;
import com.purchasingpower.contextgraph.model.artifact.Chunk;
import com.purchasingpower.contextgraph.model.artifact.Decision;
import com.purchasingpower.contextgraph.model.artifact.Gap;
import com.purchasingpower.contextgraph.model.artifact.Question;
import com.purchasingpower.contextgraph.model.artifact.RoadmapItem;

/**
 * Artifact types held in the knowledge graph.
 *
 * <p>The {@link #key()} is the persisted {@code node_type} value and the prefix of the
 * per-type index file ({@code {key}_nodes.json}).
 *
 * @since 1.0.0
 */
public enum ArtifactType {
    CHUNK("chunk", Chunk.class),
    DECISION("decision", Decision.class),
    QUESTION("question", Question.class),
    ASSESSMENT("assessment", Assessment.class),
    ROADMAP_ITEM("roadmap_item", RoadmapItem.class),
    GAP("gap", Gap.class);

    private final String key;
    private final Class<? extends Artifact> recordClass;

    ArtifactType(String key, Class<? extends Artifact> recordClass) {
        this.key = key;
        this.recordClass = recordClass;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public Class<? extends Artifact> recordClass() {
        return recordClass;
    }

    @JsonCreator
    public static ArtifactType fromKey(String key) {
        for (ArtifactType type : values()) {
            if (type.key.equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown artifact type: " + key);
    }
}
