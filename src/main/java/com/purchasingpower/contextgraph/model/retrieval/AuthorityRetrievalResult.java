package com.purchasingpower.contextgraph.model.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.contextgraph.core.AuthorityCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Retrieval hits grouped by authority category.
 *
 * Every category is present (possibly empty) and iteration always runs from decisions down
 * to pending questions.
 *
 * @see com.purchasingpower.contextgraph.search.AuthorityRetrievalService
 */
public class AuthorityRetrievalResult {
    private final Map<AuthorityCategory, List<RetrievedArtifact>> byCategory = new EnumMap<>(AuthorityCategory.class);

    public AuthorityRetrievalResult() {
        for (AuthorityCategory category : AuthorityCategory.values()) {
            byCategory.put(category, new ArrayList<>());
        }
    }

    public void add(AuthorityCategory category, RetrievedArtifact hit) {
        byCategory.get(category).add(hit);
    }

    public void put(AuthorityCategory category, List<RetrievedArtifact> hits) {
        byCategory.put(category, new ArrayList<>(hits));
    }

    public List<RetrievedArtifact> get(AuthorityCategory category) {
        return Collections.unmodifiableList(byCategory.get(category));
    }

    public int totalResults() {
        return byCategory.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return totalResults() == 0;
    }

    /**
     * Category key → hits, in authority order. Used as the JSON form.
     */
    @JsonValue
    public Map<String, List<RetrievedArtifact>> asMap() {
        Map<String, List<RetrievedArtifact>> map = new LinkedHashMap<>();
        byCategory.forEach((category, hits) -> map.put(category.getKey(), get(category)));
        return map;
    }
}
