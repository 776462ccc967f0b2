package com.purchasingpower.contextgraph.api;

import com.purchasingpower.contextgraph.model.retrieval.AuthorityRetrievalResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Authority-grouped query response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphQueryResponse {

    private boolean success;
    private String error;
    private String query;
    private int totalResults;
    private AuthorityRetrievalResult results;

    public static GraphQueryResponse success(String query, AuthorityRetrievalResult results) {
        return GraphQueryResponse.builder()
            .success(true)
            .query(query)
            .totalResults(results.totalResults())
            .results(results)
            .build();
    }

    public static GraphQueryResponse error(String error) {
        return GraphQueryResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
