package com.purchasingpower.contextgraph.service.graph.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.knowledge.KnowledgeGraph;
import com.purchasingpower.contextgraph.model.artifact.Artifact;
import com.purchasingpower.contextgraph.model.retrieval.TraversalResult;
import com.purchasingpower.contextgraph.model.retrieval.TraversedNode;
import com.purchasingpower.contextgraph.service.graph.GraphTraversalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphTraversalServiceImpl implements GraphTraversalService {

    private final ObjectMapper objectMapper;

    @Override
    public TraversalResult traverse(KnowledgeGraph graph, Collection<String> seedIds,
                                    Collection<String> topicTerms, int maxHops) {
        if (maxHops < 0) {
            throw new IllegalArgumentException("maxHops must not be negative, got " + maxHops);
        }
        List<String> terms = normalizeTerms(topicTerms);

        Set<String> visited = new HashSet<>();
        Queue<String> queue = new LinkedList<>();
        Map<String, Integer> depths = new HashMap<>();

        for (String seed : seedIds) {
            if (graph.containsNode(seed) && visited.add(seed)) {
                queue.add(seed);
                depths.put(seed, 0);
            } else if (!graph.containsNode(seed)) {
                log.debug("Ignoring unknown seed {}", seed);
            }
        }

        Map<ArtifactType, List<TraversedNode>> grouped = new EnumMap<>(ArtifactType.class);
        int deepest = 0;

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int currentDepth = depths.get(current);
            deepest = Math.max(deepest, currentDepth);

            Optional<Artifact> artifact = graph.getArtifact(current);
            if (artifact.isPresent() && (currentDepth == 0 || matchesTopic(artifact.get(), terms))) {
                grouped.computeIfAbsent(artifact.get().artifactType(), k -> new ArrayList<>())
                        .add(new TraversedNode(current, artifact.get(), currentDepth));
            }

            if (currentDepth >= maxHops) continue;

            for (String neighbor : neighbors(graph, current)) {
                if (!visited.contains(neighbor)) {
                    visited.add(neighbor);
                    queue.add(neighbor);
                    depths.put(neighbor, currentDepth + 1);
                }
            }
        }

        TraversalResult result = new TraversalResult(grouped, visited.size(), deepest);
        log.info("Traversal from {} seeds ({} hops): visited {}, kept {}",
                seedIds.size(), maxHops, visited.size(), result.totalNodes());
        return result;
    }

    @Override
    public List<String> findShortestPath(KnowledgeGraph graph, String startNode, String endNode, int maxDepth) {
        if (!graph.containsNode(startNode) || !graph.containsNode(endNode)) {
            return List.of();
        }
        Queue<List<String>> queue = new LinkedList<>();
        Set<String> visited = new HashSet<>();

        queue.add(List.of(startNode));
        visited.add(startNode);

        while (!queue.isEmpty()) {
            List<String> path = queue.poll();
            String current = path.get(path.size() - 1);

            if (current.equals(endNode)) {
                log.debug("Found path: {}", String.join("->", path));
                return path;
            }

            if (path.size() >= maxDepth) continue;

            for (String neighbor : neighbors(graph, current)) {
                if (!visited.contains(neighbor)) {
                    visited.add(neighbor);
                    List<String> newPath = new ArrayList<>(path);
                    newPath.add(neighbor);
                    queue.add(newPath);
                }
            }
        }

        return List.of();
    }

    private List<String> neighbors(KnowledgeGraph graph, String nodeId) {
        Set<String> neighbors = new LinkedHashSet<>(graph.successors(nodeId));
        neighbors.addAll(graph.predecessors(nodeId));
        return new ArrayList<>(neighbors);
    }

    private boolean matchesTopic(Artifact artifact, List<String> terms) {
        if (terms.isEmpty()) {
            return true;
        }
        String content = serialize(artifact).toLowerCase(Locale.ROOT);
        return terms.stream().anyMatch(content::contains);
    }

    private List<String> normalizeTerms(Collection<String> topicTerms) {
        if (topicTerms == null) {
            return List.of();
        }
        List<String> terms = new ArrayList<>();
        for (String term : topicTerms) {
            if (term != null && !term.isBlank()) {
                terms.add(term.strip().toLowerCase(Locale.ROOT));
            }
        }
        return terms;
    }

    private String serialize(Artifact artifact) {
        try {
            return objectMapper.writeValueAsString(artifact);
        } catch (JsonProcessingException e) {
            log.warn("⚠️  Cannot serialize {} for topic match: {}", artifact.id(), e.getMessage());
            return artifact.toString();
        }
    }
}
