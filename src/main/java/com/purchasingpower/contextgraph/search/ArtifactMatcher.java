package com.purchasingpower.contextgraph.search;

import com.purchasingpower.contextgraph.knowledge.KnowledgeGraph;

import java.util.List;

/**
 * Strategy for deciding which nodes match a query and how well.
 *
 * <p>Selected by {@code app.graph.retrieval.matcher}: {@code keyword} (default) or
 * {@code embedding}.
 *
 * @since 1.0.0
 */
public interface ArtifactMatcher {

    /**
     * Match every node of the graph against the query.
     *
     * @param query non-blank query text
     * @return matching nodes in graph insertion order
     */
    List<ArtifactMatch> match(String query, KnowledgeGraph graph);
}
