package com.purchasingpower.contextgraph.knowledge.impl;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.purchasingpower.contextgraph.configuration.ContextGraphProperties;
import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.EdgeType;
import com.purchasingpower.contextgraph.exception.GraphPersistenceException;
import com.purchasingpower.contextgraph.knowledge.GraphStore;
import com.purchasingpower.contextgraph.knowledge.KnowledgeGraph;
import com.purchasingpower.contextgraph.model.CallContext;
import com.purchasingpower.contextgraph.model.ServiceType;
import com.purchasingpower.contextgraph.model.artifact.Artifact;
import com.purchasingpower.contextgraph.model.graph.GraphDocument;
import com.purchasingpower.contextgraph.model.graph.GraphEdge;
import com.purchasingpower.contextgraph.model.graph.GraphNode;
import com.purchasingpower.contextgraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Directory-scoped JSON persistence.
 *
 * <p>Layout:
 * <ul>
 *   <li>{@code graph.json} - node-link document: node ids, {@code node_type}, optional
 *       embedding, and the edge list with {@code edge_type}, weight and metadata</li>
 *   <li>{@code {type}_nodes.json} - one map of id → artifact record per artifact type</li>
 * </ul>
 *
 * <p>A missing {@code graph.json} is a normal first start. Anything unreadable or
 * inconsistent fails the load with {@link GraphPersistenceException} rather than silently
 * returning an empty graph.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class JsonGraphStore implements GraphStore {

    static final String GRAPH_FILE = "graph.json";

    private final ObjectMapper objectMapper;
    private final Path storageDir;

    @Autowired
    public JsonGraphStore(ObjectMapper objectMapper, ContextGraphProperties properties) {
        this(objectMapper, Paths.get(properties.getStorageDir()));
    }

    public JsonGraphStore(ObjectMapper objectMapper, Path storageDir) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.storageDir = storageDir;
    }

    @Override
    public KnowledgeGraph load() {
        Path graphFile = storageDir.resolve(GRAPH_FILE);
        if (!Files.exists(graphFile)) {
            log.info("No persisted graph at {}, starting empty", storageDir);
            return new KnowledgeGraph();
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GRAPH_STORE, "Load", log);
        ctx.logRequest("Loading graph", "Directory", storageDir);

        try {
            GraphDocument document = readJson(graphFile, objectMapper.constructType(GraphDocument.class));
            Map<ArtifactType, Map<String, Artifact>> indices = readIndices();

            KnowledgeGraph graph = new KnowledgeGraph();
            restoreNodes(graph, document, indices, graphFile);
            restoreEdges(graph, document, graphFile);

            ctx.logResponse("Graph loaded", "Nodes", graph.nodeCount(), "Edges", graph.edgeCount());
            return graph;
        } catch (GraphPersistenceException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public void save(KnowledgeGraph graph) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GRAPH_STORE, "Save", log);
        ctx.logRequest("Saving graph", "Directory", storageDir,
                "Nodes", graph.nodeCount(), "Edges", graph.edgeCount());

        try {
            Files.createDirectories(storageDir);

            for (ArtifactType type : ArtifactType.values()) {
                writeJson(indexFile(type), graph.getNodesByType(type));
            }
            writeJson(storageDir.resolve(GRAPH_FILE), toDocument(graph));

            ctx.logResponse("Graph saved");
        } catch (IOException e) {
            ctx.logError("Failed to save graph", e);
            throw new GraphPersistenceException("Failed to save graph", storageDir, e);
        }
    }

    @Override
    public Optional<Instant> lastSaved() {
        Path graphFile = storageDir.resolve(GRAPH_FILE);
        if (!Files.exists(graphFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.getLastModifiedTime(graphFile).toInstant());
        } catch (IOException e) {
            throw new GraphPersistenceException("Cannot read graph timestamp", graphFile, e);
        }
    }

    // ================================================================
    // Serialization
    // ================================================================

    private GraphDocument toDocument(KnowledgeGraph graph) {
        List<GraphDocument.NodeEntry> nodes = new ArrayList<>(graph.nodeCount());
        for (GraphNode node : graph.nodes()) {
            nodes.add(new GraphDocument.NodeEntry(node.getNodeId(), node.getType().key(), node.getEmbedding()));
        }

        List<GraphDocument.LinkEntry> links = new ArrayList<>();
        for (GraphEdge edge : graph.edges()) {
            links.add(new GraphDocument.LinkEntry(
                    edge.getSourceNodeId(),
                    edge.getTargetNodeId(),
                    edge.getEdgeType().name(),
                    edge.getWeight(),
                    edge.getMetadata()));
        }
        return new GraphDocument(true, false, nodes, links);
    }

    private Map<ArtifactType, Map<String, Artifact>> readIndices() {
        Map<ArtifactType, Map<String, Artifact>> indices = new EnumMap<>(ArtifactType.class);
        for (ArtifactType type : ArtifactType.values()) {
            Path file = indexFile(type);
            if (!Files.exists(file)) {
                indices.put(type, new LinkedHashMap<>());
                continue;
            }
            JavaType mapType = objectMapper.getTypeFactory()
                    .constructMapType(LinkedHashMap.class, String.class, type.recordClass());
            Map<String, Artifact> records = readJson(file, mapType);
            indices.put(type, records != null ? records : new LinkedHashMap<>());
        }
        return indices;
    }

    private void restoreNodes(KnowledgeGraph graph, GraphDocument document,
                              Map<ArtifactType, Map<String, Artifact>> indices, Path graphFile) {
        for (GraphDocument.NodeEntry entry : document.nodes()) {
            ArtifactType type;
            try {
                type = ArtifactType.fromKey(entry.nodeType());
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new GraphPersistenceException("Node " + entry.id() + " has invalid node_type " + entry.nodeType(), graphFile, e);
            }

            Artifact data = indices.get(type).get(entry.id());
            if (data == null) {
                throw new GraphPersistenceException(
                        "Node " + entry.id() + " missing from " + indexFile(type).getFileName(), graphFile);
            }

            try {
                if (!graph.addNode(entry.id(), type, data, entry.embedding())) {
                    throw new GraphPersistenceException("Duplicate node " + entry.id(), graphFile);
                }
            } catch (IllegalArgumentException e) {
                throw new GraphPersistenceException(e.getMessage(), graphFile, e);
            }
        }

        for (ArtifactType type : ArtifactType.values()) {
            for (String id : indices.get(type).keySet()) {
                if (!graph.containsNode(id)) {
                    throw new GraphPersistenceException(
                            "Index entry " + id + " has no node in " + GRAPH_FILE, indexFile(type));
                }
            }
        }
    }

    private void restoreEdges(KnowledgeGraph graph, GraphDocument document, Path graphFile) {
        for (GraphDocument.LinkEntry link : document.links()) {
            try {
                EdgeType edgeType = EdgeType.valueOf(link.edgeType());
                graph.addEdge(link.source(), link.target(), edgeType, link.weight(), link.metadata());
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new GraphPersistenceException(
                        "Invalid edge " + link.source() + " -> " + link.target() + ": " + e.getMessage(), graphFile, e);
            }
        }
    }

    private Path indexFile(ArtifactType type) {
        return storageDir.resolve(type.key() + "_nodes.json");
    }

    private <T> T readJson(Path file, JavaType type) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new GraphPersistenceException("Malformed graph data", file, e);
        }
    }

    private void writeJson(Path file, Object value) throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writeValue(tmp.toFile(), value);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }
}
