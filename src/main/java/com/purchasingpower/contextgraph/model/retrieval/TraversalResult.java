package com.purchasingpower.contextgraph.model.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.contextgraph.core.ArtifactType;

import java.util.List;
import java.util.Map;

/**
 * Output of a multi-hop traversal, grouped by artifact type in discovery order.
 *
 * @param visitedCount nodes expanded, including those filtered out by the topic terms
 * @param hopsExplored deepest hop level that was actually reached
 */
public record TraversalResult(
        @JsonProperty("nodes_by_type") Map<ArtifactType, List<TraversedNode>> nodesByType,
        @JsonProperty("visited_count") int visitedCount,
        @JsonProperty("hops_explored") int hopsExplored
) {

    public List<TraversedNode> nodesOf(ArtifactType type) {
        return nodesByType.getOrDefault(type, List.of());
    }

    public int totalNodes() {
        return nodesByType.values().stream().mapToInt(List::size).sum();
    }
}
