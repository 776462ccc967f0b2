package com.purchasingpower.contextgraph.search;

import com.purchasingpower.contextgraph.knowledge.KnowledgeGraph;
import com.purchasingpower.contextgraph.model.retrieval.AuthorityRetrievalResult;

/**
 * Authority-aware retrieval over the knowledge graph.
 *
 * <p>Results are grouped by authority category so that downstream synthesis can let
 * decisions win over any lower-ranked content they contradict.
 *
 * @since 1.0.0
 */
public interface AuthorityRetrievalService {

    /**
     * Retrieve matching artifacts grouped by authority.
     *
     * @param query query text, must not be blank
     * @param topK maximum hits per category
     * @param includeSuperseded whether chunks overridden by a decision are kept (annotated)
     *        or dropped
     * @throws IllegalArgumentException if the query is blank or topK is not positive
     */
    AuthorityRetrievalResult retrieve(String query, KnowledgeGraph graph, int topK, boolean includeSuperseded);

    default AuthorityRetrievalResult retrieve(String query, KnowledgeGraph graph, int topK) {
        return retrieve(query, graph, topK, true);
    }
}
