package com.purchasingpower.contextgraph.knowledge;

import com.purchasingpower.contextgraph.model.sync.SyncResult;

/**
 * Brings the knowledge graph up to date with every external store.
 *
 * HOW IT WORKS:
 * <pre>
 * 1. Load the persisted graph (empty if none)
 * 2. Roadmap items → questions → decisions → architecture assessment
 *    → competitive assessments → chunks, adding only ids not yet indexed
 * 3. Recompute semantic edges from embeddings
 * 4. Persist the whole graph
 * </pre>
 *
 * A failing stage is logged and recorded in the result; later stages still run.
 */
public interface GraphSyncService {

    /**
     * Sync into the persisted graph and persist the result.
     *
     * @return statistics about what was done
     * @throws com.purchasingpower.contextgraph.exception.GraphPersistenceException if the
     *         graph cannot be loaded or saved
     */
    SyncResult sync();

    /**
     * Run all integration stages against the given graph without loading or persisting.
     */
    SyncResult sync(KnowledgeGraph graph);

    /**
     * Discard the persisted graph and sync into a fresh one. This is how changed records
     * in the external stores propagate, since sync never updates existing nodes.
     */
    SyncResult rebuild();

    /**
     * True when no graph was persisted yet or decisions/assessments changed since the last save.
     */
    boolean needsSync();

    /**
     * Load the persisted graph for read operations.
     */
    KnowledgeGraph currentGraph();
}
