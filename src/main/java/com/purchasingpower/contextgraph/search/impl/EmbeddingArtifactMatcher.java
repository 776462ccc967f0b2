package com.purchasingpower.contextgraph.search.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.configuration.ContextGraphProperties;
import com.purchasingpower.contextgraph.knowledge.EmbeddingService;
import com.purchasingpower.contextgraph.knowledge.KnowledgeGraph;
import com.purchasingpower.contextgraph.model.artifact.Artifact;
import com.purchasingpower.contextgraph.model.graph.GraphNode;
import com.purchasingpower.contextgraph.search.ArtifactMatch;
import com.purchasingpower.contextgraph.search.ArtifactMatcher;
import com.purchasingpower.contextgraph.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ranks nodes by cosine similarity between the query embedding and the node embedding.
 *
 * <p>The query is embedded once per call. Nodes without an embedding (questions,
 * assessments, gaps) fall back to keyword containment.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.graph.retrieval.matcher", havingValue = "embedding")
public class EmbeddingArtifactMatcher implements ArtifactMatcher {

    private final EmbeddingService embeddingService;
    private final KeywordArtifactMatcher keywordFallback;
    private final double minSimilarity;

    @Autowired
    public EmbeddingArtifactMatcher(EmbeddingService embeddingService, ObjectMapper objectMapper,
                                    ContextGraphProperties properties) {
        this(embeddingService, objectMapper, properties.getRetrieval().getMinSimilarity());
    }

    public EmbeddingArtifactMatcher(EmbeddingService embeddingService, ObjectMapper objectMapper, double minSimilarity) {
        this.embeddingService = embeddingService;
        this.keywordFallback = new KeywordArtifactMatcher(objectMapper);
        this.minSimilarity = minSimilarity;
    }

    @Override
    public List<ArtifactMatch> match(String query, KnowledgeGraph graph) {
        List<Double> queryEmbedding = embeddingService.embed(query);
        String lowerCaseQuery = query.toLowerCase(Locale.ROOT);

        List<ArtifactMatch> matches = new ArrayList<>();
        int skipped = 0;
        for (GraphNode node : graph.nodes()) {
            Optional<Artifact> artifact = graph.getArtifact(node.getNodeId());
            if (artifact.isEmpty()) {
                continue;
            }
            if (!node.hasEmbedding()) {
                keywordFallback.score(lowerCaseQuery, artifact.get()).ifPresent(matches::add);
                continue;
            }
            if (node.getEmbedding().size() != queryEmbedding.size()) {
                skipped++;
                continue;
            }
            double similarity = VectorMath.cosineSimilarity(queryEmbedding, node.getEmbedding());
            if (similarity >= minSimilarity) {
                matches.add(new ArtifactMatch(artifact.get(), similarity));
            }
        }
        if (skipped > 0) {
            log.warn("⚠️  {} nodes skipped: embedding dimension differs from query ({})", skipped, queryEmbedding.size());
        }
        log.debug("Embedding match for '{}' returned {} nodes", query, matches.size());
        return matches;
    }
}
