package com.purchasingpower.contextgraph.knowledge;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.DecisionStatus;
import com.purchasingpower.contextgraph.core.EdgeType;
import com.purchasingpower.contextgraph.core.QuestionStatus;
import com.purchasingpower.contextgraph.model.artifact.Decision;
import com.purchasingpower.contextgraph.model.artifact.Question;
import com.purchasingpower.contextgraph.model.graph.GraphEdge;

import java.util.EnumMap;
import java.util.Map;

/**
 * Snapshot of graph size and authority coverage.
 *
 * @param activeDecisions decisions whose status is {@code active}
 * @param pendingQuestions questions in any status other than {@code answered}
 */
public record GraphStatistics(
        @JsonProperty("total_nodes") int totalNodes,
        @JsonProperty("total_edges") int totalEdges,
        @JsonProperty("nodes_by_type") Map<ArtifactType, Integer> nodesByType,
        @JsonProperty("edges_by_type") Map<EdgeType, Integer> edgesByType,
        @JsonProperty("active_decisions") int activeDecisions,
        @JsonProperty("answered_questions") int answeredQuestions,
        @JsonProperty("pending_questions") int pendingQuestions,
        @JsonProperty("overridden_chunks") int overriddenChunks
) {

    public static GraphStatistics of(KnowledgeGraph graph) {
        Map<ArtifactType, Integer> nodesByType = new EnumMap<>(ArtifactType.class);
        for (ArtifactType type : ArtifactType.values()) {
            nodesByType.put(type, graph.getNodesByType(type).size());
        }

        Map<EdgeType, Integer> edgesByType = new EnumMap<>(EdgeType.class);
        for (EdgeType type : EdgeType.values()) {
            edgesByType.put(type, 0);
        }
        for (GraphEdge edge : graph.edges()) {
            edgesByType.merge(edge.getEdgeType(), 1, Integer::sum);
        }
        long overridden = graph.edges().stream()
                .filter(edge -> edge.getEdgeType() == EdgeType.OVERRIDES)
                .map(GraphEdge::getTargetNodeId)
                .distinct()
                .count();

        int active = (int) graph.getNodesByType(ArtifactType.DECISION, Decision.class).values().stream()
                .filter(d -> d.status() == DecisionStatus.ACTIVE)
                .count();
        int answered = (int) graph.getNodesByType(ArtifactType.QUESTION, Question.class).values().stream()
                .filter(q -> q.status() == QuestionStatus.ANSWERED)
                .count();
        int pending = nodesByType.get(ArtifactType.QUESTION) - answered;

        return new GraphStatistics(graph.nodeCount(), graph.edgeCount(), nodesByType, edgesByType,
                active, answered, pending, (int) overridden);
    }
}
