package com.purchasingpower.contextgraph.model.graph;

import com.purchasingpower.contextgraph.core.EdgeType;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Directed, typed, weighted relationship between two nodes.
 * At most one edge exists per ordered (source, target) pair.
 *
 * <p>Immutable: the graph hands edges out to callers, and endpoint types are only checked
 * when an edge is added.
 */
@Value
@Builder
public class GraphEdge {

    String sourceNodeId;

    String targetNodeId;

    EdgeType edgeType;

    double weight;

    Map<String, Object> metadata;

    private GraphEdge(String sourceNodeId, String targetNodeId, EdgeType edgeType, double weight,
                      Map<String, Object> metadata) {
        this.sourceNodeId = sourceNodeId;
        this.targetNodeId = targetNodeId;
        this.edgeType = edgeType;
        this.weight = weight;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }
}
