package com.purchasingpower.contextgraph.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.AssessmentType;
import com.purchasingpower.contextgraph.core.DecisionStatus;
import com.purchasingpower.contextgraph.core.EdgeType;
import com.purchasingpower.contextgraph.core.Horizon;
import com.purchasingpower.contextgraph.core.QuestionStatus;
import com.purchasingpower.contextgraph.model.artifact.Assessment;
import com.purchasingpower.contextgraph.model.artifact.Chunk;
import com.purchasingpower.contextgraph.model.artifact.Decision;
import com.purchasingpower.contextgraph.model.artifact.Gap;
import com.purchasingpower.contextgraph.model.artifact.Question;
import com.purchasingpower.contextgraph.model.artifact.RoadmapItem;
import com.purchasingpower.contextgraph.model.graph.GraphEdge;
import com.purchasingpower.contextgraph.model.source.ChunkRecord;
import com.purchasingpower.contextgraph.model.sync.IntegrationTally;
import com.purchasingpower.contextgraph.parser.RoadmapParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.decision;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.question;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ArtifactIntegrator")
class ArtifactIntegratorTest {

    private static final String ROADMAP = """
            # Product Roadmap

            ## Now
            ### Search Revamp
            Rebuild search on a new engine.
            Dependencies: Data Platform

            ## Next
            ### Data Platform
            Central event store.
            """;

    private FakeEmbeddingService embeddingService;
    private ArtifactIntegrator integrator;
    private KnowledgeGraph graph;
    private IntegrationTally tally;

    @BeforeEach
    void setUp() {
        embeddingService = new FakeEmbeddingService();
        integrator = new ArtifactIntegrator(embeddingService, new RoadmapParser(), new ObjectMapper());
        graph = new KnowledgeGraph();
        tally = new IntegrationTally();
    }

    @Test
    @DisplayName("Roadmap items are embedded in one batch with name and description")
    void integrateRoadmap_batchesEmbeddings() {
        integrator.integrateRoadmap(graph, ROADMAP, tally);

        assertThat(graph.getNodesByType(ArtifactType.ROADMAP_ITEM)).containsOnlyKeys("ri_search_revamp", "ri_data_platform");
        assertThat(embeddingService.batches()).hasSize(1);
        assertThat(embeddingService.batches().get(0))
                .containsExactly("Search Revamp. Rebuild search on a new engine.", "Data Platform. Central event store.");
        RoadmapItem search = graph.getNodesByType(ArtifactType.ROADMAP_ITEM, RoadmapItem.class).get("ri_search_revamp");
        assertThat(search.horizon()).isEqualTo(Horizon.NOW);
        assertThat(search.dependencies()).containsExactly("Data Platform");
        assertThat(graph.getEmbedding("ri_search_revamp")).isPresent();
        assertThat(tally.nodesAdded(ArtifactType.ROADMAP_ITEM)).isEqualTo(2);
    }

    @Test
    @DisplayName("Known roadmap items are not re-embedded")
    void integrateRoadmap_skipsExisting() {
        integrator.integrateRoadmap(graph, ROADMAP, tally);

        integrator.integrateRoadmap(graph, ROADMAP, new IntegrationTally());

        assertThat(embeddingService.batches()).hasSize(1);
    }

    @Test
    @DisplayName("Questions link to roadmap items by case-insensitive name")
    void integrateQuestions_linksAboutItem() {
        integrator.integrateRoadmap(graph, ROADMAP, tally);

        integrator.integrateQuestions(graph,
                List.of(question("q1", "Which engine?", QuestionStatus.PENDING, List.of("search revamp", "Nope"))), tally);

        GraphEdge edge = graph.getEdge("q1", "ri_search_revamp").orElseThrow();
        assertThat(edge.getEdgeType()).isEqualTo(EdgeType.ABOUT_ITEM);
        assertThat(edge.getWeight()).isEqualTo(0.8);
        assertThat(graph.outgoingEdges("q1")).hasSize(1);
        assertThat(graph.getEmbedding("q1")).isEmpty();
    }

    @Test
    @DisplayName("A decision resolves its question, marks it answered, and impacts named roadmap items")
    void integrateDecisions_resolvesAndImpacts() {
        // Given
        integrator.integrateRoadmap(graph, ROADMAP, tally);
        integrator.integrateQuestions(graph,
                List.of(question("q1", "Which engine?", QuestionStatus.PENDING, List.of())), tally);

        // When
        integrator.integrateDecisions(graph,
                List.of(decision("d1", "Use OpenSearch", "q1", List.of("SEARCH REVAMP"))), tally);

        // Then
        assertThat(graph.getEdge("d1", "q1")).map(GraphEdge::getEdgeType).contains(EdgeType.RESOLVES);
        assertThat(graph.getEdge("d1", "ri_search_revamp")).map(GraphEdge::getEdgeType).contains(EdgeType.IMPACTS);
        Question q1 = graph.getNodesByType(ArtifactType.QUESTION, Question.class).get("q1");
        assertThat(q1.status()).isEqualTo(QuestionStatus.ANSWERED);
        assertThat(q1.answeredByDecision()).isEqualTo("d1");
        assertThat(embeddingService.batches().get(1)).containsExactly("Use OpenSearch. Because it is cheaper");
    }

    @Test
    @DisplayName("A decision with blank statement and rationale is added without embedding")
    void integrateDecisions_blankTextHasNoEmbedding() {
        Decision blank = new Decision("d2", "", " ", List.of(), null, DecisionStatus.ACTIVE, null, List.of(), null, null);

        integrator.integrateDecisions(graph, List.of(blank, decision("d3", "Ship it")), tally);

        assertThat(graph.containsNode("d2")).isTrue();
        assertThat(graph.getEmbedding("d2")).isEmpty();
        assertThat(graph.getEmbedding("d3")).isPresent();
        assertThat(embeddingService.batches()).hasSize(1);
        assertThat(embeddingService.batches().get(0)).hasSize(1);
    }

    @Test
    @DisplayName("A decision pointing at an unknown question creates no edge")
    void integrateDecisions_unknownQuestion() {
        integrator.integrateDecisions(graph, List.of(decision("d1", "x", "q404", List.of())), tally);

        assertThat(graph.containsNode("d1")).isTrue();
        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    @DisplayName("Architecture assessment gets a default id and the serialized payload as summary")
    void integrateArchitectureAssessment_defaults() {
        Map<String, Object> payload = Map.of("analysis", Map.of(
                "roadmap_gaps", List.of(
                        Map.of("gap_description", "No audit log", "severity", "high"),
                        Map.of("description", "Weak caching"))));

        integrator.integrateArchitectureAssessment(graph, payload, tally);

        Assessment assessment = graph.getNodesByType(ArtifactType.ASSESSMENT, Assessment.class).get("arch_alignment_001");
        assertThat(assessment.type()).isEqualTo(AssessmentType.ARCHITECTURE);
        assertThat(assessment.summary()).startsWith("{").contains("roadmap_gaps");
        assertThat(assessment.summary().length()).isLessThanOrEqualTo(200);

        Map<String, Gap> gaps = graph.getNodesByType(ArtifactType.GAP, Gap.class);
        assertThat(gaps).containsOnlyKeys("gap_arch_alignment_001_0", "gap_arch_alignment_001_1");
        assertThat(gaps.get("gap_arch_alignment_001_0").severity()).isEqualTo("high");
        assertThat(gaps.get("gap_arch_alignment_001_1").severity()).isEqualTo("medium");
        assertThat(gaps.get("gap_arch_alignment_001_1").description()).isEqualTo("Weak caching");
        assertThat(gaps.get("gap_arch_alignment_001_1").identifiedBy()).isEqualTo("arch_alignment_001");
        assertThat(graph.getEdge("arch_alignment_001", "gap_arch_alignment_001_0"))
                .map(GraphEdge::getWeight).contains(0.9);
    }

    @Test
    @DisplayName("Competitive assessments use the executive summary; those without id are skipped")
    void integrateCompetitiveAssessment() {
        String longSummary = "x".repeat(300);
        integrator.integrateCompetitiveAssessment(graph,
                Map.of("id", "comp_1", "analysis", Map.of("executive_summary", longSummary,
                        "roadmap_gaps", List.of(Map.of("gap", "No mobile app")))), tally);
        integrator.integrateCompetitiveAssessment(graph, Map.of("analysis", Map.of()), tally);

        Assessment assessment = graph.getNodesByType(ArtifactType.ASSESSMENT, Assessment.class).get("comp_1");
        assertThat(assessment.summary()).hasSize(200);
        assertThat(graph.getNodesByType(ArtifactType.ASSESSMENT)).hasSize(1);
        assertThat(graph.getNodesByType(ArtifactType.GAP, Gap.class).get("gap_comp_1_0").description())
                .isEqualTo("No mobile app");
    }

    @Test
    @DisplayName("Chunks keep their vector and default the lens to unknown")
    void integrateChunks() {
        integrator.integrateChunks(graph, List.of(
                new ChunkRecord("c1", "text", null, "notes", "notes.md", 0, 10, List.of(0.5, 0.5)),
                new ChunkRecord(null, "no id", "eng", null, null, 0, 0, null),
                new ChunkRecord("c2", "plain", "eng", null, null, 1, 3, List.of())), tally);

        Map<String, Chunk> chunks = graph.getNodesByType(ArtifactType.CHUNK, Chunk.class);
        assertThat(chunks).containsOnlyKeys("c1", "c2");
        assertThat(chunks.get("c1").lens()).isEqualTo("unknown");
        assertThat(graph.getEmbedding("c1")).contains(List.of(0.5, 0.5));
        assertThat(graph.getEmbedding("c2")).isEmpty();
        assertThat(tally.nodesAdded(ArtifactType.CHUNK)).isEqualTo(2);
    }

    @Test
    @DisplayName("A decision whose id is held by another type is skipped and later decisions still land")
    void integrateDecisions_crossTypeIdClash() {
        // Given
        integrator.integrateQuestions(graph,
                List.of(question("X1", "Which engine?", QuestionStatus.PENDING, List.of())), tally);

        // When
        integrator.integrateDecisions(graph, List.of(decision("X1", "Use OpenSearch"), decision("D2", "Ship it")), tally);

        // Then
        assertThat(graph.getNodesByType(ArtifactType.DECISION)).containsOnlyKeys("D2");
        assertThat(graph.getArtifact("X1")).get().isInstanceOf(Question.class);
        assertThat(embeddingService.batches()).singleElement()
                .satisfies(batch -> assertThat(batch).containsExactly("Ship it. Because it is cheaper"));
        assertThat(tally.nodesAdded(ArtifactType.DECISION)).isEqualTo(1);
    }

    @Test
    @DisplayName("Questions and chunks with a clashing id do not abort the rest of the stage")
    void integrate_crossTypeIdClashDoesNotAbortStage() {
        // Given
        integrator.integrateDecisions(graph, List.of(decision("shared", "Use OpenSearch")), tally);

        // When
        integrator.integrateQuestions(graph, List.of(
                question("shared", "Which engine?", QuestionStatus.PENDING, List.of()),
                question("q2", "When?", QuestionStatus.PENDING, List.of())), tally);
        integrator.integrateChunks(graph, List.of(
                new ChunkRecord("shared", "clash", "eng", null, null, 0, 1, null),
                new ChunkRecord("c2", "fine", "eng", null, null, 1, 1, null)), tally);

        // Then
        assertThat(graph.getNodesByType(ArtifactType.QUESTION)).containsOnlyKeys("q2");
        assertThat(graph.getNodesByType(ArtifactType.CHUNK)).containsOnlyKeys("c2");
        assertThat(graph.getArtifact("shared")).get().isInstanceOf(Decision.class);
    }
}
