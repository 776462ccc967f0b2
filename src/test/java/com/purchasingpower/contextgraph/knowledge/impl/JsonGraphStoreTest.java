package com.purchasingpower.contextgraph.knowledge.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.EdgeType;
import com.purchasingpower.contextgraph.core.QuestionStatus;
import com.purchasingpower.contextgraph.exception.GraphPersistenceException;
import com.purchasingpower.contextgraph.knowledge.KnowledgeGraph;
import com.purchasingpower.contextgraph.model.artifact.Assessment;
import com.purchasingpower.contextgraph.model.artifact.Decision;
import com.purchasingpower.contextgraph.model.artifact.Question;
import com.purchasingpower.contextgraph.model.graph.GraphEdge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.chunk;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.decision;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.gap;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.question;
import static com.purchasingpower.contextgraph.knowledge.TestArtifacts.roadmapItem;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsonGraphStore")
class JsonGraphStoreTest {

    @TempDir
    Path storageDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Loading from an empty directory yields an empty graph")
    void load_missingGraphFile() {
        JsonGraphStore store = new JsonGraphStore(objectMapper, storageDir.resolve("not-there"));

        KnowledgeGraph graph = store.load();

        assertThat(graph.nodeCount()).isZero();
        assertThat(store.lastSaved()).isEmpty();
    }

    @Test
    @DisplayName("Save then load preserves nodes, records, embeddings and edges")
    void saveAndLoad_roundTrip() {
        // Given
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addNode(roadmapItem("Search Revamp", "Rebuild search"), List.of(0.1, 0.2, 0.3));
        graph.addNode(question("q1", "Which engine?", QuestionStatus.ANSWERED, List.of("Search Revamp")), null);
        graph.addNode(decision("d1", "Use OpenSearch", "q1", List.of("Search Revamp")), List.of(0.3, 0.2, 0.1));
        graph.addNode(new Assessment("a1", null, "summary", Map.of("analysis", Map.of("executive_summary", "x"))), null);
        graph.addNode(gap("gap_a1_0", "No relevance tuning"), null);
        graph.addNode(chunk("c1", "We will use Solr"), List.of(0.3, 0.2, 0.11));
        graph.addEdge("d1", "q1", EdgeType.RESOLVES);
        graph.addEdge("d1", "ri_search_revamp", EdgeType.IMPACTS);
        graph.addEdge("a1", "gap_a1_0", EdgeType.IDENTIFIES_GAP);
        graph.addEdge("d1", "c1", EdgeType.OVERRIDES, 0.82, Map.of("similarity", 0.82));

        JsonGraphStore store = new JsonGraphStore(objectMapper, storageDir);

        // When
        store.save(graph);
        KnowledgeGraph loaded = store.load();

        // Then
        assertThat(loaded.nodeCount()).isEqualTo(6);
        assertThat(loaded.edgeCount()).isEqualTo(4);
        for (ArtifactType type : ArtifactType.values()) {
            assertThat(loaded.getNodesByType(type)).isEqualTo(graph.getNodesByType(type));
        }
        assertThat(loaded.getEmbedding("d1")).contains(List.of(0.3, 0.2, 0.1));
        assertThat(loaded.getEmbedding("q1")).isEmpty();
        GraphEdge overrides = loaded.getEdge("d1", "c1").orElseThrow();
        assertThat(overrides.getEdgeType()).isEqualTo(EdgeType.OVERRIDES);
        assertThat(overrides.getWeight()).isEqualTo(0.82);
        assertThat(overrides.getMetadata()).containsEntry("similarity", 0.82);

        Decision decision = (Decision) loaded.getArtifact("d1").orElseThrow();
        assertThat(decision.questionId()).isEqualTo("q1");
        assertThat(((Question) loaded.getArtifact("q1").orElseThrow()).status()).isEqualTo(QuestionStatus.ANSWERED);
        assertThat(store.lastSaved()).isPresent();
    }

    @Test
    @DisplayName("Writes graph.json plus one index file per artifact type")
    void save_writesLayout() throws Exception {
        KnowledgeGraph graph = new KnowledgeGraph();
        graph.addNode(chunk("c1", "text"), List.of(1.0));

        new JsonGraphStore(objectMapper, storageDir).save(graph);

        assertThat(storageDir.resolve("graph.json")).exists();
        for (ArtifactType type : ArtifactType.values()) {
            assertThat(storageDir.resolve(type.key() + "_nodes.json")).exists();
        }
        String graphJson = Files.readString(storageDir.resolve("graph.json"));
        assertThat(graphJson).contains("\"node_type\" : \"chunk\"").contains("\"links\"");
        String chunkJson = Files.readString(storageDir.resolve("chunk_nodes.json"));
        assertThat(chunkJson).contains("\"source_file\"").contains("\"chunk_index\"");
    }

    @Test
    @DisplayName("Malformed graph.json fails the load instead of returning an empty graph")
    void load_malformedJson() throws Exception {
        Files.writeString(storageDir.resolve("graph.json"), "{ not json");

        JsonGraphStore store = new JsonGraphStore(objectMapper, storageDir);

        assertThatThrownBy(store::load).isInstanceOf(GraphPersistenceException.class);
    }

    @Test
    @DisplayName("Unknown node_type fails the load")
    void load_unknownNodeType() throws Exception {
        Files.writeString(storageDir.resolve("graph.json"), """
                {"directed": true, "multigraph": false,
                 "nodes": [{"id": "n1", "node_type": "widget"}],
                 "links": []}
                """);

        assertThatThrownBy(() -> new JsonGraphStore(objectMapper, storageDir).load())
                .isInstanceOf(GraphPersistenceException.class)
                .hasMessageContaining("widget");
    }

    @Test
    @DisplayName("A node missing from its index file fails the load")
    void load_indexMismatch() throws Exception {
        Files.writeString(storageDir.resolve("graph.json"), """
                {"directed": true, "multigraph": false,
                 "nodes": [{"id": "c1", "node_type": "chunk"}],
                 "links": []}
                """);
        Files.writeString(storageDir.resolve("chunk_nodes.json"), "{}");

        assertThatThrownBy(() -> new JsonGraphStore(objectMapper, storageDir).load())
                .isInstanceOf(GraphPersistenceException.class)
                .hasMessageContaining("c1");
    }

    @Test
    @DisplayName("An edge to an unknown node fails the load")
    void load_danglingEdge() throws Exception {
        Files.writeString(storageDir.resolve("graph.json"), """
                {"directed": true, "multigraph": false,
                 "nodes": [{"id": "c1", "node_type": "chunk"}],
                 "links": [{"source": "d9", "target": "c1", "edge_type": "OVERRIDES", "weight": 0.9}]}
                """);
        Files.writeString(storageDir.resolve("chunk_nodes.json"), """
                {"c1": {"id": "c1", "content": "x"}}
                """);

        assertThatThrownBy(() -> new JsonGraphStore(objectMapper, storageDir).load())
                .isInstanceOf(GraphPersistenceException.class)
                .hasMessageContaining("d9");
    }
}
