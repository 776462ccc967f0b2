package com.purchasingpower.contextgraph.core;

import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.contextgraph.model.artifact.Artifact;
import com.purchasingpower.contextgraph.model.artifact.Question;

/**
 * Fixed authority hierarchy. Lower rank means higher authority.
 *
 * <p>Declaration order equals rank order, so iterating {@code values()} or an
 * {@link java.util.EnumMap} keyed by this type always yields decisions first and pending
 * questions last.
 *
 * @since 1.0.0
 */
public enum AuthorityCategory {
    DECISIONS(1, "decisions", 0.9),
    ANSWERED_QUESTIONS(2, "answered_questions", 0.8),
    ASSESSMENTS(3, "assessments", 0.8),
    ROADMAP_ITEMS(4, "roadmap_items", 0.7),
    GAPS(5, "gaps", 0.7),
    CHUNKS(6, "chunks", 0.6),
    PENDING_QUESTIONS(7, "pending_questions", 0.7);

    private final int rank;
    private final String key;
    private final double keywordSimilarity;

    AuthorityCategory(int rank, String key, double keywordSimilarity) {
        this.rank = rank;
        this.key = key;
        this.keywordSimilarity = keywordSimilarity;
    }

    public int getRank() {
        return rank;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * Similarity reported for a plain keyword hit in this category.
     */
    public double getKeywordSimilarity() {
        return keywordSimilarity;
    }

    /**
     * Resolve the category of an artifact. Questions split on their status; every other type
     * maps one to one.
     */
    public static AuthorityCategory of(Artifact artifact) {
        return switch (artifact.artifactType()) {
            case DECISION -> DECISIONS;
            case QUESTION -> ((Question) artifact).status() == QuestionStatus.ANSWERED
                ? ANSWERED_QUESTIONS
                : PENDING_QUESTIONS;
            case ASSESSMENT -> ASSESSMENTS;
            case ROADMAP_ITEM -> ROADMAP_ITEMS;
            case GAP -> GAPS;
            case CHUNK -> CHUNKS;
        };
    }

    public static int rank(Artifact artifact) {
        return of(artifact).rank;
    }
}
