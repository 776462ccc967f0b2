package com.purchasingpower.contextgraph.knowledge;

import com.purchasingpower.contextgraph.core.EdgeType;

import java.util.Map;

/**
 * Outcome of one semantic edge inference pass.
 *
 * @param edgesByType edges created, per semantic edge type
 * @param chunksCompared chunks that had an embedding and were compared
 * @param chunksSkipped chunks without an embedding
 * @param edgesRemoved semantic edges from the previous pass that were cleared first
 */
public record InferenceReport(
        Map<EdgeType, Integer> edgesByType,
        int chunksCompared,
        int chunksSkipped,
        int edgesRemoved
) {

    public int totalEdges() {
        return edgesByType.values().stream().mapToInt(Integer::intValue).sum();
    }
}
