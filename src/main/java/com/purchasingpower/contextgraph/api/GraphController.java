package com.purchasingpower.contextgraph.api;

import com.purchasingpower.contextgraph.configuration.ContextGraphProperties;
import com.purchasingpower.contextgraph.knowledge.AuthorityResolver;
import com.purchasingpower.contextgraph.knowledge.GraphStatistics;
import com.purchasingpower.contextgraph.knowledge.GraphSyncService;
import com.purchasingpower.contextgraph.knowledge.KnowledgeGraph;
import com.purchasingpower.contextgraph.model.artifact.Decision;
import com.purchasingpower.contextgraph.model.retrieval.AuthorityRetrievalResult;
import com.purchasingpower.contextgraph.model.retrieval.TraversalResult;
import com.purchasingpower.contextgraph.model.sync.SyncResult;
import com.purchasingpower.contextgraph.search.AuthorityRetrievalService;
import com.purchasingpower.contextgraph.search.ContextFormatter;
import com.purchasingpower.contextgraph.service.graph.GraphTraversalService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * REST controller for the unified knowledge graph.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/graph")
@RequiredArgsConstructor
public class GraphController {

    private final GraphSyncService syncService;
    private final AuthorityRetrievalService retrievalService;
    private final ContextFormatter contextFormatter;
    private final GraphTraversalService traversalService;
    private final AuthorityResolver authorityResolver;
    private final ContextGraphProperties properties;

    /**
     * Sync every source into the persisted graph.
     *
     * POST /api/v1/graph/sync
     */
    @PostMapping("/sync")
    public ResponseEntity<SyncResponse> sync() {
        try {
            SyncResult result = syncService.sync();
            return ResponseEntity.ok(SyncResponse.success(result));
        } catch (Exception e) {
            log.error("Sync failed", e);
            return ResponseEntity.internalServerError()
                .body(SyncResponse.error("Sync failed: " + e.getMessage()));
        }
    }

    /**
     * Discard the persisted graph and sync from scratch.
     *
     * POST /api/v1/graph/rebuild
     */
    @PostMapping("/rebuild")
    public ResponseEntity<SyncResponse> rebuild() {
        try {
            SyncResult result = syncService.rebuild();
            return ResponseEntity.ok(SyncResponse.success(result));
        } catch (Exception e) {
            log.error("Rebuild failed", e);
            return ResponseEntity.internalServerError()
                .body(SyncResponse.error("Rebuild failed: " + e.getMessage()));
        }
    }

    /**
     * Authority-grouped retrieval.
     *
     * GET /api/v1/graph/query?q=...&topK=20&includeSuperseded=true
     */
    @GetMapping("/query")
    public ResponseEntity<GraphQueryResponse> query(
            @RequestParam("q") String query,
            @RequestParam(value = "topK", required = false) Integer topK,
            @RequestParam(value = "includeSuperseded", defaultValue = "true") boolean includeSuperseded) {
        try {
            if (query == null || query.isBlank()) {
                return ResponseEntity.badRequest()
                    .body(GraphQueryResponse.error("Query is required"));
            }

            log.info("Graph query: {}", query);
            AuthorityRetrievalResult results = retrievalService.retrieve(
                query, syncService.currentGraph(), resolveTopK(topK), includeSuperseded);
            return ResponseEntity.ok(GraphQueryResponse.success(query, results));

        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                .body(GraphQueryResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Graph query failed", e);
            return ResponseEntity.internalServerError()
                .body(GraphQueryResponse.error("Query failed: " + e.getMessage()));
        }
    }

    /**
     * Flattened authority-ordered text brief.
     *
     * GET /api/v1/graph/brief?q=...
     */
    @GetMapping(value = "/brief", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> brief(
            @RequestParam("q") String query,
            @RequestParam(value = "topK", required = false) Integer topK) {
        try {
            if (query == null || query.isBlank()) {
                return ResponseEntity.badRequest().body("Query is required");
            }
            AuthorityRetrievalResult results = retrievalService.retrieve(
                query, syncService.currentGraph(), resolveTopK(topK));
            return ResponseEntity.ok(contextFormatter.format(results));

        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (Exception e) {
            log.error("Brief generation failed", e);
            return ResponseEntity.internalServerError().body("Brief failed: " + e.getMessage());
        }
    }

    /**
     * Multi-hop traversal from seed nodes.
     *
     * POST /api/v1/graph/traverse
     */
    @PostMapping("/traverse")
    public ResponseEntity<GraphDataResponse<TraversalResult>> traverse(@Valid @RequestBody TraverseRequest request) {
        try {
            TraversalResult result = traversalService.traverse(
                syncService.currentGraph(), request.getSeedIds(), request.getTopicTerms(), request.getMaxHops());
            return ResponseEntity.ok(GraphDataResponse.success(result));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                .body(GraphDataResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Traversal failed", e);
            return ResponseEntity.internalServerError()
                .body(GraphDataResponse.error("Traversal failed: " + e.getMessage()));
        }
    }

    /**
     * Graph size and authority coverage.
     *
     * GET /api/v1/graph/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<GraphDataResponse<GraphStatistics>> stats() {
        try {
            return ResponseEntity.ok(GraphDataResponse.success(GraphStatistics.of(syncService.currentGraph())));
        } catch (Exception e) {
            log.error("Failed to compute graph stats", e);
            return ResponseEntity.internalServerError()
                .body(GraphDataResponse.error("Stats failed: " + e.getMessage()));
        }
    }

    /**
     * Decision overriding a chunk, 404 if the chunk is not superseded.
     *
     * GET /api/v1/graph/chunks/{chunkId}/superseding-decision
     */
    @GetMapping("/chunks/{chunkId}/superseding-decision")
    public ResponseEntity<GraphDataResponse<Decision>> supersedingDecision(@PathVariable String chunkId) {
        try {
            KnowledgeGraph graph = syncService.currentGraph();
            Optional<Decision> decision = authorityResolver.getSupersedingDecision(graph, chunkId);
            if (decision.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(GraphDataResponse.error("No decision overrides chunk " + chunkId));
            }
            return ResponseEntity.ok(GraphDataResponse.success(decision.get()));
        } catch (Exception e) {
            log.error("Failed to resolve superseding decision for {}", chunkId, e);
            return ResponseEntity.internalServerError()
                .body(GraphDataResponse.error("Lookup failed: " + e.getMessage()));
        }
    }

    /**
     * Invalid traverse request bodies get the same error envelope as the other failures.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<GraphDataResponse<Void>> handleInvalidRequest(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest()
            .body(GraphDataResponse.error("Invalid request: " + details));
    }

    private int resolveTopK(Integer topK) {
        return topK != null ? topK : properties.getRetrieval().getDefaultTopK();
    }
}
