package com.purchasingpower.contextgraph.search.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.core.AuthorityCategory;
import com.purchasingpower.contextgraph.knowledge.KnowledgeGraph;
import com.purchasingpower.contextgraph.model.artifact.Artifact;
import com.purchasingpower.contextgraph.search.ArtifactMatch;
import com.purchasingpower.contextgraph.search.ArtifactMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Case-insensitive containment of the query in the serialized artifact.
 *
 * <p>Deterministic: every hit in a category gets that category's fixed similarity.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.graph.retrieval.matcher", havingValue = "keyword", matchIfMissing = true)
public class KeywordArtifactMatcher implements ArtifactMatcher {

    private final ObjectMapper objectMapper;

    @Override
    public List<ArtifactMatch> match(String query, KnowledgeGraph graph) {
        String needle = query.toLowerCase(Locale.ROOT);
        List<ArtifactMatch> matches = new ArrayList<>();
        graph.nodes().forEach(node -> graph.getArtifact(node.getNodeId())
                .flatMap(artifact -> score(needle, artifact))
                .ifPresent(matches::add));
        log.debug("Keyword '{}' matched {} nodes", query, matches.size());
        return matches;
    }

    /**
     * Score one artifact against an already lower-cased query.
     */
    Optional<ArtifactMatch> score(String lowerCaseQuery, Artifact artifact) {
        if (!serialize(artifact).toLowerCase(Locale.ROOT).contains(lowerCaseQuery)) {
            return Optional.empty();
        }
        return Optional.of(new ArtifactMatch(artifact, AuthorityCategory.of(artifact).getKeywordSimilarity()));
    }

    private String serialize(Artifact artifact) {
        try {
            return objectMapper.writeValueAsString(artifact);
        } catch (JsonProcessingException e) {
            log.warn("⚠️  Cannot serialize {} for matching, using toString: {}", artifact.id(), e.getMessage());
            return artifact.toString();
        }
    }
}
