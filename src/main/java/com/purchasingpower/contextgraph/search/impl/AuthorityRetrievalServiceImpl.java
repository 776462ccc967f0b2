package com.purchasingpower.contextgraph.search.impl;

import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.AuthorityCategory;
import com.purchasingpower.contextgraph.knowledge.AuthorityResolver;
import com.purchasingpower.contextgraph.knowledge.KnowledgeGraph;
import com.purchasingpower.contextgraph.model.artifact.Decision;
import com.purchasingpower.contextgraph.model.retrieval.AuthorityRetrievalResult;
import com.purchasingpower.contextgraph.model.retrieval.RetrievedArtifact;
import com.purchasingpower.contextgraph.search.ArtifactMatch;
import com.purchasingpower.contextgraph.search.ArtifactMatcher;
import com.purchasingpower.contextgraph.search.AuthorityRetrievalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorityRetrievalServiceImpl implements AuthorityRetrievalService {

    private final ArtifactMatcher matcher;
    private final AuthorityResolver authorityResolver;

    @Override
    public AuthorityRetrievalResult retrieve(String query, KnowledgeGraph graph, int topK, boolean includeSuperseded) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive, got " + topK);
        }

        Map<AuthorityCategory, List<RetrievedArtifact>> grouped = new EnumMap<>(AuthorityCategory.class);
        int dropped = 0;
        for (ArtifactMatch match : matcher.match(query.strip(), graph)) {
            RetrievedArtifact hit = new RetrievedArtifact(match.artifact().id(), match.artifact(), match.similarity());
            if (match.artifact().artifactType() == ArtifactType.CHUNK) {
                Optional<Decision> superseding = authorityResolver.getSupersedingDecision(graph, hit.id());
                if (superseding.isPresent()) {
                    if (!includeSuperseded) {
                        dropped++;
                        continue;
                    }
                    hit = hit.withSupersededBy(superseding.get().id());
                }
            }
            grouped.computeIfAbsent(authorityResolver.categoryOf(match.artifact()), k -> new ArrayList<>()).add(hit);
        }

        AuthorityRetrievalResult result = new AuthorityRetrievalResult();
        grouped.forEach((category, hits) -> {
            // List.sort is stable, equal scores keep graph order
            hits.sort(Comparator.comparingDouble(RetrievedArtifact::similarity).reversed());
            result.put(category, hits.size() > topK ? hits.subList(0, topK) : hits);
        });

        log.info("Retrieved {} artifacts for '{}' (topK={}, {} superseded chunks dropped)",
                result.totalResults(), query, topK, dropped);
        return result;
    }
}
