package com.purchasingpower.contextgraph.model.sync;

import com.purchasingpower.contextgraph.core.ArtifactType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Running count of nodes and structural edges created during a sync pass.
 */
public class IntegrationTally {

    private final Map<ArtifactType, Integer> nodesAdded = new EnumMap<>(ArtifactType.class);
    private int edgesAdded;

    public void nodeAdded(ArtifactType type) {
        nodesAdded.merge(type, 1, Integer::sum);
    }

    public void edgeAdded() {
        edgesAdded++;
    }

    public int nodesAdded(ArtifactType type) {
        return nodesAdded.getOrDefault(type, 0);
    }

    public Map<ArtifactType, Integer> getNodesAdded() {
        return Collections.unmodifiableMap(nodesAdded);
    }

    public int getTotalNodesAdded() {
        return nodesAdded.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getEdgesAdded() {
        return edgesAdded;
    }
}
