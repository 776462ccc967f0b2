package com.purchasingpower.contextgraph.model.sync;

import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.knowledge.InferenceReport;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Result of a sync pass.
 *
 * Contains statistics about what was synced:
 * - nodes added per artifact type
 * - structural and semantic edges created
 * - stages that failed and why
 * - timing information
 */
@Data
@Builder
public class SyncResult {

    private final boolean rebuild;
    private final Map<ArtifactType, Integer> nodesAdded;
    private final int structuralEdgesAdded;
    private final InferenceReport inference;
    private final Map<SyncStage, String> stageFailures;
    private final int totalNodes;
    private final int totalEdges;
    private final long totalTimeMs;

    /**
     * Human-readable summary of the sync operation.
     */
    public String summary() {
        int semantic = inference != null ? inference.totalEdges() : 0;
        return String.format(
                "[%s] %d nodes added, %d structural + %d semantic edges, graph now %d nodes / %d edges in %dms%s",
                rebuild ? "REBUILD" : "SYNC", getNodesAddedTotal(), structuralEdgesAdded, semantic,
                totalNodes, totalEdges, totalTimeMs,
                stageFailures.isEmpty() ? "" : " (failed stages: " + stageFailures.keySet() + ")"
        );
    }

    public int getNodesAddedTotal() {
        return nodesAdded.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Returns true if any node or structural edge was added.
     */
    public boolean hadChanges() {
        return getNodesAddedTotal() > 0 || structuralEdgesAdded > 0;
    }

    /**
     * Returns true if every stage completed.
     */
    public boolean isSuccess() {
        return stageFailures.isEmpty();
    }
}
