package com.purchasingpower.contextgraph.search.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.knowledge.FakeEmbeddingService;
import com.purchasingpower.contextgraph.knowledge.KnowledgeGraph;
import com.purchasingpower.contextgraph.search.ArtifactMatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.atCosine;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.chunk;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.decision;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.gap;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("EmbeddingArtifactMatcher")
class EmbeddingArtifactMatcherTest {

    @Test
    @DisplayName("Ranks embedded nodes by cosine and falls back to keywords for the rest")
    void match_embeddingWithKeywordFallback() {
        // Given
        FakeEmbeddingService embeddings = new FakeEmbeddingService().defaultVector(List.of(1.0, 0.0));
        EmbeddingArtifactMatcher matcher = new EmbeddingArtifactMatcher(embeddings, new ObjectMapper(), 0.5);

        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addNode(decision("d1", "Use OpenSearch"), atCosine(0.9));
        graph.addNode(chunk("c1", "Lunch"), atCosine(0.3));
        graph.addNode(chunk("c2", "Wrong size"), List.of(1.0, 0.0, 0.0));
        graph.addNode(gap("g1", "no search analytics"), null);
        graph.addNode(gap("g2", "no billing"), null);

        // When
        List<ArtifactMatch> matches = matcher.match("search", graph);

        // Then
        assertThat(matches).extracting(m -> m.artifact().id()).containsExactly("d1", "g1");
        assertThat(matches.get(0).similarity()).isCloseTo(0.9, within(1e-9));
        assertThat(matches.get(1).similarity()).isEqualTo(0.7);
        assertThat(embeddings.batches()).hasSize(1);
    }
}
