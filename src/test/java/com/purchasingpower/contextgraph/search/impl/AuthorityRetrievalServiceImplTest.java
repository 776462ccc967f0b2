package com.purchasingpower.contextgraph.search.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.core.AuthorityCategory;
import com.purchasingpower.contextgraph.core.EdgeType;
import com.purchasingpower.contextgraph.core.QuestionStatus;
import com.purchasingpower.contextgraph.knowledge.AuthorityResolver;
import com.purchasingpower.contextgraph.knowledge.KnowledgeGraph;
import com.purchasingpower.contextgraph.model.retrieval.AuthorityRetrievalResult;
import com.purchasingpower.contextgraph.model.retrieval.RetrievedArtifact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.assessment;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.chunk;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.decision;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.gap;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.question;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.roadmapItem;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuthorityRetrievalServiceImpl with keyword matching")
class AuthorityRetrievalServiceImplTest {

    private AuthorityRetrievalServiceImpl service;
    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        service = new AuthorityRetrievalServiceImpl(new KeywordArtifactMatcher(new ObjectMapper()), new AuthorityResolver());
        graph = new KnowledgeGraph();
        graph.addNode(chunk("c1", "Search should use Solr"), null);
        graph.addNode(question("q1", "Which search engine?", QuestionStatus.PENDING, List.of()), null);
        graph.addNode(question("q2", "Search latency budget?", QuestionStatus.ANSWERED, List.of()), null);
        graph.addNode(decision("d1", "Search runs on OpenSearch"), null);
        graph.addNode(roadmapItem("Search Revamp", "New engine"), null);
        graph.addNode(gap("g1", "No search analytics"), null);
        graph.addNode(assessment("a1", "Competitors have better search"), null);
        graph.addNode(roadmapItem("Billing", "Invoices"), null);
    }

    @Test
    @DisplayName("Hits are grouped by authority with the fixed keyword similarity")
    void retrieve_groupsByAuthority() {
        AuthorityRetrievalResult result = service.retrieve("SEARCH", graph, 20);

        assertThat(result.get(AuthorityCategory.DECISIONS)).extracting(RetrievedArtifact::id).containsExactly("d1");
        assertThat(result.get(AuthorityCategory.ANSWERED_QUESTIONS)).extracting(RetrievedArtifact::id).containsExactly("q2");
        assertThat(result.get(AuthorityCategory.ASSESSMENTS)).extracting(RetrievedArtifact::id).containsExactly("a1");
        assertThat(result.get(AuthorityCategory.ROADMAP_ITEMS)).extracting(RetrievedArtifact::id).containsExactly("ri_search_revamp");
        assertThat(result.get(AuthorityCategory.GAPS)).extracting(RetrievedArtifact::id).containsExactly("g1");
        assertThat(result.get(AuthorityCategory.CHUNKS)).extracting(RetrievedArtifact::id).containsExactly("c1");
        assertThat(result.get(AuthorityCategory.PENDING_QUESTIONS)).extracting(RetrievedArtifact::id).containsExactly("q1");
        assertThat(result.get(AuthorityCategory.DECISIONS).get(0).similarity()).isEqualTo(0.9);
        assertThat(result.get(AuthorityCategory.CHUNKS).get(0).similarity()).isEqualTo(0.6);
    }

    @Test
    @DisplayName("JSON form lists categories from decisions down to pending questions")
    void retrieve_categoryOrder() {
        AuthorityRetrievalResult result = service.retrieve("search", graph, 20);

        Map<String, List<RetrievedArtifact>> asMap = result.asMap();
        assertThat(asMap.keySet()).containsExactly("decisions", "answered_questions", "assessments",
                "roadmap_items", "gaps", "chunks", "pending_questions");
    }

    @Test
    @DisplayName("Each category is capped at topK")
    void retrieve_topK() {
        graph.addNode(decision("d2", "Search index nightly"), null);
        graph.addNode(decision("d3", "Search logs retained"), null);

        AuthorityRetrievalResult result = service.retrieve("search", graph, 2);

        assertThat(result.get(AuthorityCategory.DECISIONS)).extracting(RetrievedArtifact::id).containsExactly("d1", "d2");
    }

    @Test
    @DisplayName("Superseded chunks are annotated by default and dropped on request")
    void retrieve_superseded() {
        graph.addEdge("d1", "c1", EdgeType.OVERRIDES, 0.82);

        AuthorityRetrievalResult kept = service.retrieve("solr", graph, 20);
        AuthorityRetrievalResult dropped = service.retrieve("solr", graph, 20, false);

        assertThat(kept.get(AuthorityCategory.CHUNKS)).singleElement()
                .satisfies(hit -> assertThat(hit.supersededBy()).isEqualTo("d1"));
        assertThat(dropped.get(AuthorityCategory.CHUNKS)).isEmpty();
    }

    @Test
    @DisplayName("No match yields an empty result, blank query is rejected")
    void retrieve_edgeCases() {
        assertThat(service.retrieve("kubernetes", graph, 20).isEmpty()).isTrue();
        assertThatThrownBy(() -> service.retrieve("  ", graph, 20)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.retrieve("search", graph, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
