package com.purchasingpower.contextgraph.knowledge.impl;

import com.purchasingpower.contextgraph.knowledge.ArtifactIntegrator;
import com.purchasingpower.contextgraph.knowledge.GraphStore;
import com.purchasingpower.contextgraph.knowledge.GraphSyncService;
import com.purchasingpower.contextgraph.knowledge.InferenceReport;
import com.purchasingpower.contextgraph.knowledge.KnowledgeGraph;
import com.purchasingpower.contextgraph.knowledge.SemanticEdgeInferencer;
import com.purchasingpower.contextgraph.model.sync.IntegrationTally;
import com.purchasingpower.contextgraph.model.sync.SyncResult;
import com.purchasingpower.contextgraph.model.sync.SyncStage;
import com.purchasingpower.contextgraph.source.AssessmentSource;
import com.purchasingpower.contextgraph.source.ChunkSource;
import com.purchasingpower.contextgraph.source.DecisionStore;
import com.purchasingpower.contextgraph.source.QuestionStore;
import com.purchasingpower.contextgraph.source.RoadmapSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphSyncServiceImpl implements GraphSyncService {

    private final GraphStore graphStore;
    private final ArtifactIntegrator integrator;
    private final SemanticEdgeInferencer inferencer;
    private final RoadmapSource roadmapSource;
    private final QuestionStore questionStore;
    private final DecisionStore decisionStore;
    private final AssessmentSource assessmentSource;
    private final ChunkSource chunkSource;

    @Override
    public SyncResult sync() {
        log.info("🔄 Syncing unified context graph...");
        return syncAndPersist(graphStore.load(), false);
    }

    @Override
    public SyncResult rebuild() {
        log.info("🔄 Rebuilding unified context graph from scratch...");
        return syncAndPersist(new KnowledgeGraph(), true);
    }

    @Override
    public SyncResult sync(KnowledgeGraph graph) {
        return runStages(graph, false, System.currentTimeMillis(), new EnumMap<>(SyncStage.class));
    }

    @Override
    public boolean needsSync() {
        Optional<Instant> lastSaved = graphStore.lastSaved();
        if (lastSaved.isEmpty()) {
            return true;
        }
        return Stream.of(decisionStore.lastModified(), assessmentSource.lastModified())
                .flatMap(Optional::stream)
                .anyMatch(modified -> modified.isAfter(lastSaved.get()));
    }

    @Override
    public KnowledgeGraph currentGraph() {
        return graphStore.load();
    }

    private SyncResult syncAndPersist(KnowledgeGraph graph, boolean rebuild) {
        long start = System.currentTimeMillis();
        Map<SyncStage, String> failures = new EnumMap<>(SyncStage.class);
        SyncResult staged = runStages(graph, rebuild, start, failures);

        try {
            graphStore.save(graph);
        } catch (RuntimeException e) {
            log.error("❌ Failed to persist graph: {}", e.getMessage());
            throw e;
        }

        SyncResult result = SyncResult.builder()
                .rebuild(rebuild)
                .nodesAdded(staged.getNodesAdded())
                .structuralEdgesAdded(staged.getStructuralEdgesAdded())
                .inference(staged.getInference())
                .stageFailures(staged.getStageFailures())
                .totalNodes(graph.nodeCount())
                .totalEdges(graph.edgeCount())
                .totalTimeMs(System.currentTimeMillis() - start)
                .build();
        log.info("✅ {}", result.summary());
        return result;
    }

    private SyncResult runStages(KnowledgeGraph graph, boolean rebuild, long start, Map<SyncStage, String> failures) {
        IntegrationTally tally = new IntegrationTally();

        runStage(SyncStage.ROADMAP, failures, () ->
                roadmapSource.readRoadmap().ifPresent(content -> integrator.integrateRoadmap(graph, content, tally)));

        runStage(SyncStage.QUESTIONS, failures, () ->
                integrator.integrateQuestions(graph, questionStore.loadQuestions(), tally));

        runStage(SyncStage.DECISIONS, failures, () ->
                integrator.integrateDecisions(graph, decisionStore.loadDecisions(), tally));

        runStage(SyncStage.ARCHITECTURE_ASSESSMENT, failures, () ->
                assessmentSource.loadArchitectureAssessment()
                        .ifPresent(payload -> integrator.integrateArchitectureAssessment(graph, payload, tally)));

        runStage(SyncStage.COMPETITIVE_ASSESSMENTS, failures, () ->
                assessmentSource.loadCompetitiveAssessments()
                        .forEach(payload -> integrator.integrateCompetitiveAssessment(graph, payload, tally)));

        runStage(SyncStage.CHUNKS, failures, () ->
                integrator.integrateChunks(graph, chunkSource.loadChunks(), tally));

        InferenceReport[] inference = new InferenceReport[1];
        runStage(SyncStage.SEMANTIC_EDGES, failures, () -> inference[0] = inferencer.inferEdges(graph));

        return SyncResult.builder()
                .rebuild(rebuild)
                .nodesAdded(tally.getNodesAdded())
                .structuralEdgesAdded(tally.getEdgesAdded())
                .inference(inference[0])
                .stageFailures(failures)
                .totalNodes(graph.nodeCount())
                .totalEdges(graph.edgeCount())
                .totalTimeMs(System.currentTimeMillis() - start)
                .build();
    }

    private void runStage(SyncStage stage, Map<SyncStage, String> failures, Runnable work) {
        try {
            work.run();
            log.debug("Stage {} complete", stage.getLabel());
        } catch (Exception e) {
            log.warn("⚠️  Could not sync {}: {}", stage.getLabel(), e.getMessage());
            log.debug("Stage {} failure details", stage.getLabel(), e);
            failures.put(stage, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
