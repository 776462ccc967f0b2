package com.purchasingpower.contextgraph.knowledge;

import com.purchasingpower.contextgraph.configuration.ContextGraphProperties;
import com.purchasingpower.contextgraph.configuration.InferenceProperties;
import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.EdgeType;
import com.purchasingpower.contextgraph.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Materializes edges between chunks and roadmap items/decisions from embedding similarity.
 *
 * <ul>
 *   <li>roadmap item ↔ chunk, similarity ≥ supported-by threshold → {@code SUPPORTED_BY}</li>
 *   <li>roadmap item ↔ chunk, mentioned-in ≤ similarity &lt; supported-by → {@code MENTIONED_IN}</li>
 *   <li>decision ↔ chunk, similarity ≥ overrides threshold → {@code OVERRIDES}</li>
 * </ul>
 *
 * <p>Every pass first clears the semantic edges of the previous pass and recomputes the full
 * set: O(R·C + D·C) similarity computations.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class SemanticEdgeInferencer {

    private final double supportedByThreshold;
    private final double mentionedInThreshold;
    private final double overridesThreshold;

    @Autowired
    public SemanticEdgeInferencer(ContextGraphProperties properties) {
        this(properties.getInference());
    }

    public SemanticEdgeInferencer(InferenceProperties inference) {
        if (inference.getMentionedInThreshold() > inference.getSupportedByThreshold()) {
            throw new IllegalArgumentException("mentioned-in threshold must not exceed supported-by threshold");
        }
        this.supportedByThreshold = inference.getSupportedByThreshold();
        this.mentionedInThreshold = inference.getMentionedInThreshold();
        this.overridesThreshold = inference.getOverridesThreshold();
    }

    public InferenceReport inferEdges(KnowledgeGraph graph) {
        int removed = graph.removeEdgesOfType(EdgeType.SEMANTIC);

        // cached once per pass
        Map<String, List<Double>> roadmapEmbeddings = embeddingsOf(graph, ArtifactType.ROADMAP_ITEM);
        Map<String, List<Double>> decisionEmbeddings = embeddingsOf(graph, ArtifactType.DECISION);

        log.info("Creating semantic edges for {} chunks against {} roadmap items, {} decisions",
                graph.getNodesByType(ArtifactType.CHUNK).size(), roadmapEmbeddings.size(), decisionEmbeddings.size());

        Map<EdgeType, Integer> created = new EnumMap<>(EdgeType.class);
        EdgeType.SEMANTIC.forEach(type -> created.put(type, 0));
        int compared = 0;
        int skipped = 0;

        for (String chunkId : graph.getNodesByType(ArtifactType.CHUNK).keySet()) {
            Optional<List<Double>> chunkEmbedding = graph.getEmbedding(chunkId);
            if (chunkEmbedding.isEmpty()) {
                skipped++;
                continue;
            }
            compared++;

            for (Map.Entry<String, List<Double>> item : roadmapEmbeddings.entrySet()) {
                Optional<Double> similarity = similarity(chunkEmbedding.get(), item.getValue(), chunkId, item.getKey());
                if (similarity.isEmpty()) {
                    continue;
                }
                EdgeType edgeType = classifyRoadmapLink(similarity.get());
                if (edgeType != null) {
                    graph.addEdge(item.getKey(), chunkId, edgeType, similarity.get());
                    created.merge(edgeType, 1, Integer::sum);
                }
            }

            for (Map.Entry<String, List<Double>> decision : decisionEmbeddings.entrySet()) {
                Optional<Double> similarity = similarity(chunkEmbedding.get(), decision.getValue(), chunkId, decision.getKey());
                if (similarity.isPresent() && similarity.get() >= overridesThreshold) {
                    graph.addEdge(decision.getKey(), chunkId, EdgeType.OVERRIDES, similarity.get());
                    created.merge(EdgeType.OVERRIDES, 1, Integer::sum);
                }
            }
        }

        InferenceReport report = new InferenceReport(created, compared, skipped, removed);
        log.info("✅ Created {} semantic edges across {} chunks ({} without embedding). Thresholds: SUPPORTED_BY≥{}, MENTIONED_IN≥{}, OVERRIDES≥{}",
                report.totalEdges(), compared, skipped, supportedByThreshold, mentionedInThreshold, overridesThreshold);
        return report;
    }

    /**
     * Edge type for a roadmap item/chunk pair, checked in threshold order. Null below every threshold.
     */
    EdgeType classifyRoadmapLink(double similarity) {
        if (similarity >= supportedByThreshold) {
            return EdgeType.SUPPORTED_BY;
        }
        if (similarity >= mentionedInThreshold) {
            return EdgeType.MENTIONED_IN;
        }
        return null;
    }

    private Map<String, List<Double>> embeddingsOf(KnowledgeGraph graph, ArtifactType type) {
        Map<String, List<Double>> embeddings = new LinkedHashMap<>();
        for (String id : graph.getNodesByType(type).keySet()) {
            graph.getEmbedding(id).ifPresent(embedding -> embeddings.put(id, embedding));
        }
        return embeddings;
    }

    private Optional<Double> similarity(List<Double> chunkEmbedding, List<Double> other, String chunkId, String otherId) {
        try {
            return Optional.of(VectorMath.cosineSimilarity(chunkEmbedding, other));
        } catch (IllegalArgumentException e) {
            log.warn("⚠️  Skipping {} ↔ {}: {}", chunkId, otherId, e.getMessage());
            return Optional.empty();
        }
    }
}
