package com.purchasingpower.contextgraph.knowledge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.core.ArtifactType;
import com.purchasingpower.contextgraph.core.AssessmentType;
import com.purchasingpower.contextgraph.core.EdgeType;
import com.purchasingpower.contextgraph.core.QuestionStatus;
import com.purchasingpower.contextgraph.model.artifact.Artifact;
import com.purchasingpower.contextgraph.model.artifact.Assessment;
import com.purchasingpower.contextgraph.model.artifact.Chunk;
import com.purchasingpower.contextgraph.model.artifact.Decision;
import com.purchasingpower.contextgraph.model.artifact.Gap;
import com.purchasingpower.contextgraph.model.artifact.Question;
import com.purchasingpower.contextgraph.model.artifact.RoadmapItem;
import com.purchasingpower.contextgraph.model.graph.GraphNode;
import com.purchasingpower.contextgraph.model.source.ChunkRecord;
import com.purchasingpower.contextgraph.model.sync.IntegrationTally;
import com.purchasingpower.contextgraph.parser.RoadmapParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw source records into graph nodes and structural edges.
 *
 * <p>Every method skips ids that are already indexed for the artifact's type. An id held by
 * a node of another type is logged and that one record is skipped; the rest of the batch
 * is still integrated. Roadmap items and decisions are embedded in one batch per call.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArtifactIntegrator {

    static final String DEFAULT_ARCHITECTURE_ID = "arch_alignment_001";
    private static final int SUMMARY_LENGTH = 200;

    private final EmbeddingService embeddingService;
    private final RoadmapParser roadmapParser;
    private final ObjectMapper objectMapper;

    // =========================================================================
    // Roadmap
    // =========================================================================

    public void integrateRoadmap(KnowledgeGraph graph, String roadmapContent, IntegrationTally tally) {
        List<RoadmapItem> fresh = new ArrayList<>();
        for (RoadmapItem item : roadmapParser.parse(roadmapContent)) {
            boolean seen = fresh.stream().anyMatch(f -> f.id().equals(item.id()));
            if (!seen && isNew(graph, item)) {
                fresh.add(item);
            }
        }
        if (fresh.isEmpty()) {
            log.debug("No new roadmap items");
            return;
        }

        log.info("Generating embeddings for {} roadmap items", fresh.size());
        List<List<Double>> embeddings = embeddingService.embedAll(fresh.stream().map(RoadmapItem::embeddingText).toList());
        requireSameSize(fresh.size(), embeddings.size());

        for (int i = 0; i < fresh.size(); i++) {
            if (graph.addNode(fresh.get(i), embeddings.get(i))) {
                tally.nodeAdded(ArtifactType.ROADMAP_ITEM);
            }
        }
    }

    // =========================================================================
    // Questions
    // =========================================================================

    public void integrateQuestions(KnowledgeGraph graph, List<Question> questions, IntegrationTally tally) {
        for (Question question : questions) {
            if (question.id() == null || question.id().isBlank()) {
                log.warn("⚠️  Skipping question without id: {}", question.text());
                continue;
            }
            if (!isNew(graph, question) || !graph.addNode(question, null)) {
                continue;
            }
            tally.nodeAdded(ArtifactType.QUESTION);

            for (String itemName : question.relatedRoadmapItems()) {
                for (String itemId : roadmapItemsNamed(graph, itemName)) {
                    linkIfAbsent(graph, question.id(), itemId, EdgeType.ABOUT_ITEM, tally);
                }
            }
        }
    }

    // =========================================================================
    // Decisions
    // =========================================================================

    public void integrateDecisions(KnowledgeGraph graph, List<Decision> decisions, IntegrationTally tally) {
        List<Decision> fresh = new ArrayList<>();
        for (Decision decision : decisions) {
            if (decision.id() == null || decision.id().isBlank()) {
                log.warn("⚠️  Skipping decision without id: {}", decision.statement());
                continue;
            }
            boolean seen = fresh.stream().anyMatch(f -> f.id().equals(decision.id()));
            if (!seen && isNew(graph, decision)) {
                fresh.add(decision);
            }
        }
        if (fresh.isEmpty()) {
            return;
        }

        List<Decision> embeddable = fresh.stream().filter(Decision::hasEmbeddableText).toList();
        List<List<Double>> embeddings = embeddable.isEmpty()
                ? List.of()
                : embeddingService.embedAll(embeddable.stream().map(Decision::embeddingText).toList());
        requireSameSize(embeddable.size(), embeddings.size());

        int next = 0;
        for (Decision decision : fresh) {
            List<Double> embedding = decision.hasEmbeddableText() ? embeddings.get(next++) : null;
            if (!graph.addNode(decision, embedding)) {
                continue;
            }
            tally.nodeAdded(ArtifactType.DECISION);
            linkResolvedQuestion(graph, decision, tally);
            for (String itemName : decision.relatedRoadmapItems()) {
                for (String itemId : roadmapItemsNamed(graph, itemName)) {
                    linkIfAbsent(graph, decision.id(), itemId, EdgeType.IMPACTS, tally);
                }
            }
        }
    }

    private void linkResolvedQuestion(KnowledgeGraph graph, Decision decision, IntegrationTally tally) {
        String questionId = decision.questionId();
        if (questionId == null || questionId.isBlank()) {
            return;
        }
        Question question = graph.getNodesByType(ArtifactType.QUESTION, Question.class).get(questionId);
        if (question == null) {
            log.debug("Decision {} resolves unknown question {}", decision.id(), questionId);
            return;
        }
        linkIfAbsent(graph, decision.id(), questionId, EdgeType.RESOLVES, tally);
        if (question.status() != QuestionStatus.ANSWERED || !decision.id().equals(question.answeredByDecision())) {
            graph.replaceArtifact(question.answeredBy(decision.id()));
            log.info("Question {} answered by decision {}", questionId, decision.id());
        }
    }

    // =========================================================================
    // Assessments
    // =========================================================================

    /**
     * Integrate the architecture alignment payload. A payload without an id gets
     * {@value #DEFAULT_ARCHITECTURE_ID}.
     */
    public void integrateArchitectureAssessment(KnowledgeGraph graph, Map<String, Object> payload,
                                                IntegrationTally tally) {
        String id = stringValue(payload.get("id"));
        if (id == null) {
            id = DEFAULT_ARCHITECTURE_ID;
        }
        integrateAssessment(graph, id, AssessmentType.ARCHITECTURE, serialize(payload), payload, tally);
    }

    /**
     * Integrate one competitive analyst assessment. Payloads without an id are skipped.
     */
    public void integrateCompetitiveAssessment(KnowledgeGraph graph, Map<String, Object> payload,
                                               IntegrationTally tally) {
        String id = stringValue(payload.get("id"));
        if (id == null) {
            log.warn("⚠️  Skipping competitive assessment without id");
            return;
        }
        String summary = stringValue(analysis(payload).get("executive_summary"));
        integrateAssessment(graph, id, AssessmentType.COMPETITIVE, summary, payload, tally);
    }

    private void integrateAssessment(KnowledgeGraph graph, String id, AssessmentType type, String summary,
                                     Map<String, Object> payload, IntegrationTally tally) {
        Assessment assessment = new Assessment(id, type, truncate(summary, SUMMARY_LENGTH), payload);
        if (!isNew(graph, assessment) || !graph.addNode(assessment, null)) {
            return;
        }
        tally.nodeAdded(ArtifactType.ASSESSMENT);

        Object rawGaps = analysis(payload).get("roadmap_gaps");
        if (!(rawGaps instanceof List<?> gaps)) {
            return;
        }
        for (int i = 0; i < gaps.size(); i++) {
            Gap gap = toGap(gaps.get(i), "gap_" + id + "_" + i, type, id);
            if (!isNew(graph, gap)) {
                continue;
            }
            graph.addNode(gap, null);
            tally.nodeAdded(ArtifactType.GAP);
            linkIfAbsent(graph, id, gap.id(), EdgeType.IDENTIFIES_GAP, tally);
        }
    }

    private Gap toGap(Object raw, String gapId, AssessmentType type, String assessmentId) {
        if (raw instanceof Map<?, ?> map) {
            String description = firstNonNull(
                    stringValue(map.get("gap_description")),
                    stringValue(map.get("gap")),
                    stringValue(map.get("description")));
            return new Gap(gapId, description, stringValue(map.get("severity")), type, assessmentId);
        }
        return new Gap(gapId, stringValue(raw), null, type, assessmentId);
    }

    // =========================================================================
    // Chunks
    // =========================================================================

    public void integrateChunks(KnowledgeGraph graph, List<ChunkRecord> records, IntegrationTally tally) {
        int withoutEmbedding = 0;
        for (ChunkRecord record : records) {
            if (record.id() == null || record.id().isBlank()) {
                continue;
            }
            List<Double> embedding = record.embedding() == null || record.embedding().isEmpty()
                    ? null
                    : record.embedding();
            Chunk chunk = record.toChunk();
            if (isNew(graph, chunk) && graph.addNode(chunk, embedding)) {
                tally.nodeAdded(ArtifactType.CHUNK);
                if (embedding == null) {
                    withoutEmbedding++;
                }
            }
        }
        if (withoutEmbedding > 0) {
            log.warn("⚠️  {} new chunks have no embedding and will not get semantic edges", withoutEmbedding);
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /**
     * True when the artifact's id is not yet indexed for its type. An id already held by a
     * node of another type is logged and rejected.
     */
    private boolean isNew(KnowledgeGraph graph, Artifact artifact) {
        if (graph.getNodesByType(artifact.artifactType()).containsKey(artifact.id())) {
            return false;
        }
        Optional<GraphNode> clash = graph.getNode(artifact.id());
        if (clash.isPresent()) {
            log.warn("⚠️  Skipping {} {}: id already used by a {} node",
                    artifact.artifactType().key(), artifact.id(), clash.get().getType().key());
            return false;
        }
        return true;
    }

    private List<String> roadmapItemsNamed(KnowledgeGraph graph, String name) {
        if (name == null || name.isBlank()) {
            return List.of();
        }
        String wanted = name.toLowerCase(Locale.ROOT);
        List<String> ids = new ArrayList<>();
        graph.getNodesByType(ArtifactType.ROADMAP_ITEM, RoadmapItem.class).forEach((id, item) -> {
            if (item.name() != null && item.name().toLowerCase(Locale.ROOT).equals(wanted)) {
                ids.add(id);
            }
        });
        return ids;
    }

    private void linkIfAbsent(KnowledgeGraph graph, String from, String to, EdgeType type, IntegrationTally tally) {
        if (!graph.hasEdge(from, to)) {
            graph.addEdge(from, to, type);
            tally.edgeAdded();
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> analysis(Map<String, Object> payload) {
        Object analysis = payload.get("analysis");
        return analysis instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private String serialize(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize assessment payload", e);
        }
    }

    private static String stringValue(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return "";
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    private static void requireSameSize(int expected, int actual) {
        if (expected != actual) {
            throw new IllegalStateException("Embedding service returned " + actual + " vectors for " + expected + " texts");
        }
    }
}
