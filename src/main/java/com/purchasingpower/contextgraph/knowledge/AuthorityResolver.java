package com.purchasingpower.contextgraph.knowledge;

import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.AuthorityCategory;
import com.purchasingpower.contextgraph.core.EdgeType;
import com.purchasingpower.contextgraph.model.artifact.Artifact;
import com.purchasingpower.contextgraph.model.artifact.Chunk;
import com.purchasingpower.contextgraph.model.artifact.Decision;
import com.purchasingpower.contextgraph.model.graph.GraphEdge;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Authority hierarchy and override lookups.
 *
 * <p>Decisions annotate precedence through {@code OVERRIDES} edges instead of deleting the
 * evidence they contradict; consumers use this class to flag superseded chunks.
 *
 * @since 1.0.0
 */
@Component
public class AuthorityResolver {

    public int rank(Artifact artifact) {
        return AuthorityCategory.rank(artifact);
    }

    public AuthorityCategory categoryOf(Artifact artifact) {
        return AuthorityCategory.of(artifact);
    }

    /**
     * Orders artifacts from highest to lowest authority.
     */
    public Comparator<Artifact> byAuthority() {
        return Comparator.comparingInt(this::rank);
    }

    /**
     * Decision that overrides the given chunk, if any. Walks the chunk's predecessors
     * looking for an {@code OVERRIDES} edge.
     */
    public Optional<Decision> getSupersedingDecision(KnowledgeGraph graph, String chunkId) {
        for (GraphEdge edge : graph.incomingEdges(chunkId)) {
            if (edge.getEdgeType() == EdgeType.OVERRIDES) {
                Decision decision = graph.getNodesByType(ArtifactType.DECISION, Decision.class)
                        .get(edge.getSourceNodeId());
                if (decision != null) {
                    return Optional.of(decision);
                }
            }
        }
        return Optional.empty();
    }

    public boolean isSuperseded(KnowledgeGraph graph, String chunkId) {
        return getSupersedingDecision(graph, chunkId).isPresent();
    }

    /**
     * Chunks the given decision overrides, in edge insertion order.
     */
    public List<Chunk> getOverriddenChunks(KnowledgeGraph graph, String decisionId) {
        List<Chunk> chunks = new ArrayList<>();
        var chunkIndex = graph.getNodesByType(ArtifactType.CHUNK, Chunk.class);
        for (GraphEdge edge : graph.outgoingEdges(decisionId)) {
            if (edge.getEdgeType() == EdgeType.OVERRIDES) {
                Chunk chunk = chunkIndex.get(edge.getTargetNodeId());
                if (chunk != null) {
                    chunks.add(chunk);
                }
            }
        }
        return chunks;
    }
}
