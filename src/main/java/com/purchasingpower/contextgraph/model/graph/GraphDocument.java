package com.purchasingpower.contextgraph.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Node-link document written to {@code graph.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphDocument(
        boolean directed,
        boolean multigraph,
        List<NodeEntry> nodes,
        List<LinkEntry> links
) {

    public GraphDocument {
        nodes = nodes != null ? nodes : List.of();
        links = links != null ? links : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record NodeEntry(
            String id,
            @JsonProperty("node_type") String nodeType,
            List<Double> embedding
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LinkEntry(
            String source,
            String target,
            @JsonProperty("edge_type") String edgeType,
            double weight,
            Map<String, Object> metadata
    ) {
    }
}
