package com.purchasingpower.contextgraph.model.retrieval;

import com.purchasingpower.contextgraph.model.artifact.Artifact;

/**
 * Node reached by a multi-hop traversal.
 *
 * @param hops edge distance from the nearest seed; 0 for seeds
 */
public record TraversedNode(String id, Artifact data, int hops) {
}
