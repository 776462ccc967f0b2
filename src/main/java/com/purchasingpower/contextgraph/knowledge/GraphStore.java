package com.purchasingpower.contextgraph.knowledge;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence of the whole knowledge graph.
 *
 * <p>The graph is always written and read as a unit; there are no partial updates and
 * exactly one writer is assumed.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    /**
     * Load the persisted graph.
     *
     * @return the persisted graph, or a fresh empty graph if nothing was persisted yet
     * @throws com.purchasingpower.contextgraph.exception.GraphPersistenceException if the
     *         persisted data is malformed
     */
    KnowledgeGraph load();

    /**
     * Persist the full graph, replacing whatever was stored before.
     */
    void save(KnowledgeGraph graph);

    /**
     * Time of the last successful save, empty if the graph was never persisted.
     */
    Optional<Instant> lastSaved();
}
