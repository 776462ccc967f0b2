package com.purchasingpower.contextgraph.model.sync;

/**
 * Stages of one sync pass, in execution order. Persisting the graph is not a stage: a
 * failed save is thrown to the caller.
 */
public enum SyncStage {

    /**
     * Roadmap items parsed from the roadmap text, embedded in one batch.
     */
    ROADMAP("roadmap items"),

    QUESTIONS("questions"),

    /**
     * Decisions, embedded in one batch. Links to the questions they resolve and the
     * roadmap items they impact.
     */
    DECISIONS("decisions"),

    ARCHITECTURE_ASSESSMENT("architecture assessment"),

    COMPETITIVE_ASSESSMENTS("competitive assessments"),

    /**
     * Chunks exported by the vector store, with their embeddings.
     */
    CHUNKS("chunks"),

    /**
     * Full recompute of the similarity-derived edges.
     */
    SEMANTIC_EDGES("semantic edges");

    private final String label;

    SyncStage(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
