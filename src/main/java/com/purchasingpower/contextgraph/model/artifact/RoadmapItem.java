package com.purchasingpower.contextgraph.model.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.Horizon;

import java.util.List;

/**
 * Plan item parsed from the roadmap text.
 *
 * @param dependencies names of other roadmap items this one depends on
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoadmapItem(
        String id,
        String name,
        String description,
        Horizon horizon,
        List<String> dependencies
) implements Artifact {

    public RoadmapItem {
        description = description != null ? description : "";
        horizon = horizon != null ? horizon : Horizon.UNKNOWN;
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    @Override
    public ArtifactType artifactType() {
        return ArtifactType.ROADMAP_ITEM;
    }

    public String embeddingText() {
        return name + ". " + description;
    }
}
