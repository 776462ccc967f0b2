package com.purchasingpower.contextgraph.knowledge;

import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.EdgeType;
import com.purchasingpower.contextgraph.model.artifact.Artifact;
import com.purchasingpower.contextgraph.model.graph.GraphEdge;
import com.purchasingpower.contextgraph.model.graph.GraphNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Unified knowledge graph: the node/edge arena plus the per-type entity index.
 *
 * <p>This class is the sole owner of node and edge storage. Every other component refers
 * to nodes by id only, so cyclic relationships (a decision overriding a chunk that an item
 * it impacts is supported by) are safe to store and walk.
 *
 * <p>Instances are not thread-safe. One sync or query call is expected to own the graph
 * for its duration; create a fresh instance per test case.
 *
 * @since 1.0.0
 */
@Slf4j
public class KnowledgeGraph {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<ArtifactType, Map<String, Artifact>> index = new EnumMap<>(ArtifactType.class);
    private final Map<String, Map<String, GraphEdge>> outgoing = new LinkedHashMap<>();
    private final Map<String, Map<String, GraphEdge>> incoming = new LinkedHashMap<>();

    public KnowledgeGraph() {
        for (ArtifactType type : ArtifactType.values()) {
            index.put(type, new LinkedHashMap<>());
        }
    }

    // =========================================================================
    // Node Operations
    // =========================================================================

    /**
     * Add a node to the graph and the typed index.
     *
     * <p>Re-adding an id that is already present is a no-op: fields are never merged.
     *
     * @param id node id, must equal {@code data.id()}
     * @param type artifact type, must equal {@code data.artifactType()}
     * @param data artifact record
     * @param embedding optional embedding vector
     * @return true if the node was created, false if it already existed
     * @throws IllegalArgumentException if the id is taken by a node of another type or
     *         the record does not match id/type
     */
    public boolean addNode(String id, ArtifactType type, Artifact data, List<Double> embedding) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id is required");
        }
        if (data == null || data.artifactType() != type || !id.equals(data.id())) {
            throw new IllegalArgumentException("Artifact record does not match node " + type + ":" + id);
        }

        GraphNode existing = nodes.get(id);
        if (existing != null) {
            if (existing.getType() != type) {
                throw new IllegalArgumentException(
                    "Node id " + id + " already used by a " + existing.getType().key() + " node");
            }
            return false;
        }

        nodes.put(id, GraphNode.builder()
            .nodeId(id)
            .type(type)
            .embedding(embedding)
            .build());
        index.get(type).put(id, data);
        return true;
    }

    public boolean addNode(Artifact data, List<Double> embedding) {
        return addNode(data.id(), data.artifactType(), data, embedding);
    }

    /**
     * Replace the record of an existing node, keeping its embedding and edges.
     *
     * <p>Only used to propagate a status change caused by another artifact (a decision
     * answering a question). Sync never calls this for records re-read from a store.
     */
    public void replaceArtifact(Artifact data) {
        GraphNode node = nodes.get(data.id());
        if (node == null || node.getType() != data.artifactType()) {
            throw new IllegalArgumentException("No " + data.artifactType().key() + " node with id " + data.id());
        }
        index.get(data.artifactType()).put(data.id(), data);
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public Optional<GraphNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Optional<Artifact> getArtifact(String id) {
        GraphNode node = nodes.get(id);
        if (node == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(index.get(node.getType()).get(id));
    }

    public Optional<List<Double>> getEmbedding(String id) {
        GraphNode node = nodes.get(id);
        return node != null && node.hasEmbedding() ? Optional.of(node.getEmbedding()) : Optional.empty();
    }

    /**
     * Typed index for one artifact type (id → record), read-only view in insertion order.
     */
    public Map<String, Artifact> getNodesByType(ArtifactType type) {
        return Collections.unmodifiableMap(index.get(type));
    }

    @SuppressWarnings("unchecked")
    public <T extends Artifact> Map<String, T> getNodesByType(ArtifactType type, Class<T> recordClass) {
        if (!recordClass.isAssignableFrom(type.recordClass())) {
            throw new IllegalArgumentException(type.key() + " nodes are not " + recordClass.getSimpleName());
        }
        return (Map<String, T>) Collections.unmodifiableMap(index.get(type));
    }

    public Collection<GraphNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    // =========================================================================
    // Edge Operations
    // =========================================================================

    /**
     * Create or overwrite the directed edge {@code from → to}.
     *
     * @throws IllegalArgumentException if an endpoint is unknown or an {@code OVERRIDES} edge
     *         does not run from a decision to a chunk
     */
    public void addEdge(String from, String to, EdgeType edgeType, double weight, Map<String, Object> metadata) {
        GraphNode source = nodes.get(from);
        GraphNode target = nodes.get(to);
        if (source == null || target == null) {
            throw new IllegalArgumentException("Edge endpoints must exist: " + from + " -> " + to);
        }
        if (edgeType == EdgeType.OVERRIDES
                && (source.getType() != ArtifactType.DECISION || target.getType() != ArtifactType.CHUNK)) {
            throw new IllegalArgumentException(
                "OVERRIDES must run decision -> chunk, got " + source.getType().key() + " -> " + target.getType().key());
        }

        GraphEdge edge = GraphEdge.builder()
            .sourceNodeId(from)
            .targetNodeId(to)
            .edgeType(edgeType)
            .weight(weight)
            .metadata(metadata)
            .build();

        outgoing.computeIfAbsent(from, k -> new LinkedHashMap<>()).put(to, edge);
        incoming.computeIfAbsent(to, k -> new LinkedHashMap<>()).put(from, edge);
    }

    public void addEdge(String from, String to, EdgeType edgeType, double weight) {
        addEdge(from, to, edgeType, weight, null);
    }

    public void addEdge(String from, String to, EdgeType edgeType) {
        addEdge(from, to, edgeType, edgeType.getDefaultWeight(), null);
    }

    public boolean hasEdge(String from, String to) {
        return getEdge(from, to).isPresent();
    }

    public Optional<GraphEdge> getEdge(String from, String to) {
        Map<String, GraphEdge> out = outgoing.get(from);
        return out == null ? Optional.empty() : Optional.ofNullable(out.get(to));
    }

    public List<GraphEdge> outgoingEdges(String id) {
        Map<String, GraphEdge> out = outgoing.get(id);
        return out == null ? List.of() : List.copyOf(out.values());
    }

    public List<GraphEdge> incomingEdges(String id) {
        Map<String, GraphEdge> in = incoming.get(id);
        return in == null ? List.of() : List.copyOf(in.values());
    }

    public List<String> successors(String id) {
        Map<String, GraphEdge> out = outgoing.get(id);
        return out == null ? List.of() : List.copyOf(out.keySet());
    }

    public List<String> predecessors(String id) {
        Map<String, GraphEdge> in = incoming.get(id);
        return in == null ? List.of() : List.copyOf(in.keySet());
    }

    public List<GraphEdge> edges() {
        List<GraphEdge> all = new ArrayList<>();
        outgoing.values().forEach(out -> all.addAll(out.values()));
        return all;
    }

    public int edgeCount() {
        int count = 0;
        for (Map<String, GraphEdge> out : outgoing.values()) {
            count += out.size();
        }
        return count;
    }

    /**
     * Remove every edge whose type is in {@code edgeTypes}.
     *
     * @return number of edges removed
     */
    public int removeEdgesOfType(Set<EdgeType> edgeTypes) {
        int removed = 0;
        for (Map<String, GraphEdge> out : outgoing.values()) {
            var it = out.values().iterator();
            while (it.hasNext()) {
                GraphEdge edge = it.next();
                if (edgeTypes.contains(edge.getEdgeType())) {
                    it.remove();
                    Map<String, GraphEdge> in = incoming.get(edge.getTargetNodeId());
                    if (in != null) {
                        in.remove(edge.getSourceNodeId());
                    }
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Removed {} edges of types {}", removed, edgeTypes);
        }
        return removed;
    }

    @Override
    public String toString() {
        return "KnowledgeGraph[" + nodeCount() + " nodes, " + edgeCount() + " edges]";
    }
}
