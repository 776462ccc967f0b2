package com.purchasingpower.contextgraph.model.graph;

import com.purchasingpower.contextgraph.core.ArtifactType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Node in the knowledge graph arena. Holds identity, type and the optional embedding;
 * the artifact record itself lives in the typed index.
 */
@Value
@Builder
public class GraphNode {

    String nodeId;

    ArtifactType type;

    List<Double> embedding; // null when the source supplied none

    private GraphNode(String nodeId, ArtifactType type, List<Double> embedding) {
        this.nodeId = nodeId;
        this.type = type;
        this.embedding = embedding != null ? List.copyOf(embedding) : null;
    }

    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }
}
