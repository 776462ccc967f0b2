package com.purchasingpower.contextgraph.knowledge;

import com.purchasingpower.contextgraph.core.AuthorityCategory;
import com.purchasingpower.contextgraph.core.EdgeType;
import com.purchasingpower.contextgraph.core.QuestionStatus;
import com.purchasingpower.contextgraph.model.artifact.Artifact;
import com.purchasingpower.contextgraph.model.artifact.Chunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.assessment;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.chunk;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.decision;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.gap;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.question;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.roadmapItem;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuthorityResolver")
class AuthorityResolverTest {

    private final AuthorityResolver resolver = new AuthorityResolver();

    @Test
    @DisplayName("Ranks follow the fixed hierarchy, questions split on status")
    void rank_followsHierarchy() {
        assertThat(resolver.rank(decision("d", "x"))).isEqualTo(1);
        assertThat(resolver.rank(question("q", "x", QuestionStatus.ANSWERED, List.of()))).isEqualTo(2);
        assertThat(resolver.rank(assessment("a", "x"))).isEqualTo(3);
        assertThat(resolver.rank(roadmapItem("r", "x"))).isEqualTo(4);
        assertThat(resolver.rank(gap("g", "x"))).isEqualTo(5);
        assertThat(resolver.rank(chunk("c", "x"))).isEqualTo(6);
        assertThat(resolver.rank(question("q", "x", QuestionStatus.PENDING, List.of()))).isEqualTo(7);
        assertThat(resolver.rank(question("q", "x", QuestionStatus.DEFERRED, List.of()))).isEqualTo(7);
    }

    @Test
    @DisplayName("Sorting by authority puts decisions first and pending questions last")
    void byAuthority_sorts() {
        List<Artifact> artifacts = new ArrayList<>(List.of(
                question("q", "x", QuestionStatus.PENDING, List.of()),
                chunk("c", "x"),
                decision("d", "x"),
                roadmapItem("r", "x")));

        artifacts.sort(resolver.byAuthority());

        assertThat(artifacts).extracting(resolver::categoryOf).containsExactly(
                AuthorityCategory.DECISIONS,
                AuthorityCategory.ROADMAP_ITEMS,
                AuthorityCategory.CHUNKS,
                AuthorityCategory.PENDING_QUESTIONS);
    }

    @Test
    @DisplayName("Superseding decision and overridden chunks are resolved through OVERRIDES edges")
    void overrideLookups() {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addNode(decision("d1", "x"), null);
        graph.addNode(roadmapItem("Search", "s"), null);
        graph.addNode(chunk("c1", "a"), null);
        graph.addNode(chunk("c2", "b"), null);
        graph.addEdge("d1", "c1", EdgeType.OVERRIDES, 0.8);
        graph.addEdge("ri_search", "c2", EdgeType.SUPPORTED_BY, 0.8);

        assertThat(resolver.isSuperseded(graph, "c1")).isTrue();
        assertThat(resolver.isSuperseded(graph, "c2")).isFalse();
        assertThat(resolver.getSupersedingDecision(graph, "unknown")).isEmpty();
        assertThat(resolver.getOverriddenChunks(graph, "d1")).extracting(Chunk::id).containsExactly("c1");
    }
}
