package com.purchasingpower.contextgraph.search;

import com.purchasingpower.contextgraph.model.artifact.Artifact;

/**
 * A node that matched a query, with its score.
 */
public record ArtifactMatch(Artifact artifact, double similarity) {
}
