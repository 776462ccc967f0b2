package com.purchasingpower.contextgraph.service.graph;

import com.purchasingpower.contextgraph.knowledge.KnowledgeGraph;
import com.purchasingpower.contextgraph.model.retrieval.TraversalResult;

import java.util.Collection;
import java.util.List;

/**
 * Service for walking the knowledge graph outward from seed nodes.
 * Edges are followed in both directions, so a chunk reaches the decision overriding it
 * and a decision reaches the question it resolves.
 */
public interface GraphTraversalService {

    /**
     * Breadth-first expansion from the seeds.
     *
     * @param seedIds starting nodes; ids not in the graph are ignored
     * @param topicTerms nodes whose serialized content contains none of these terms
     *        (case-insensitive) are left out of the result but still expanded; empty keeps all
     * @param maxHops maximum edge distance from a seed
     * @return reached nodes grouped by artifact type, each with its hop distance
     */
    TraversalResult traverse(KnowledgeGraph graph, Collection<String> seedIds, Collection<String> topicTerms, int maxHops);

    /**
     * Find shortest path between two nodes, ignoring edge direction.
     *
     * @param maxDepth Maximum number of nodes on the path
     * @return node ids from start to end, or an empty list if no path exists
     */
    List<String> findShortestPath(KnowledgeGraph graph, String startNode, String endNode, int maxDepth);
}
