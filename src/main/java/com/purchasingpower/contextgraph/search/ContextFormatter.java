package com.purchasingpower.contextgraph.search;

import com.purchasingpower.contextgraph.core.AuthorityCategory;
import com.purchasingpower.contextgraph.model.artifact.Assessment;
import com.purchasingpower.contextgraph.model.artifact.Chunk;
import com.purchasingpower.contextgraph.model.artifact.Decision;
import com.purchasingpower.contextgraph.model.artifact.Gap;
import com.purchasingpower.contextgraph.model.artifact.Question;
import com.purchasingpower.contextgraph.model.artifact.RoadmapItem;
import com.purchasingpower.contextgraph.model.retrieval.AuthorityRetrievalResult;
import com.purchasingpower.contextgraph.model.retrieval.RetrievedArtifact;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens an {@link AuthorityRetrievalResult} into the text brief handed to synthesis.
 *
 * <p>Sections appear in authority order, each with its own item limit. Empty categories
 * produce no section.
 */
@Component
public class ContextFormatter {

    static final int DECISION_LIMIT = 5;
    static final int ANSWERED_LIMIT = 5;
    static final int ASSESSMENT_LIMIT = 5;
    static final int ROADMAP_LIMIT = 10;
    static final int GAP_LIMIT = 10;
    static final int CHUNK_LIMIT = 5;
    static final int OPEN_QUESTION_LIMIT = 10;

    public String format(AuthorityRetrievalResult result) {
        List<String> sections = new ArrayList<>();

        List<RetrievedArtifact> decisions = limit(result.get(AuthorityCategory.DECISIONS), DECISION_LIMIT);
        if (!decisions.isEmpty()) {
            sections.add("## RESOLVED DECISIONS (Highest Authority)");
            sections.add("These decisions override conflicting content.\n");
            for (RetrievedArtifact hit : decisions) {
                Decision d = (Decision) hit.data();
                sections.add("### " + d.id());
                sections.add("**Decision:** " + orNa(d.statement()));
                sections.add("**Rationale:** " + orNa(d.rationale()) + "\n");
            }
        }

        List<RetrievedArtifact> answered = limit(result.get(AuthorityCategory.ANSWERED_QUESTIONS), ANSWERED_LIMIT);
        if (!answered.isEmpty()) {
            sections.add("## ANSWERED QUESTIONS");
            for (RetrievedArtifact hit : answered) {
                sections.add("- " + orNa(((Question) hit.data()).text()) + " (Answered)\n");
            }
        }

        List<RetrievedArtifact> assessments = limit(result.get(AuthorityCategory.ASSESSMENTS), ASSESSMENT_LIMIT);
        if (!assessments.isEmpty()) {
            sections.add("## ASSESSMENTS");
            for (RetrievedArtifact hit : assessments) {
                Assessment a = (Assessment) hit.data();
                String type = a.type() != null ? a.type().value() : "Assessment";
                sections.add("- " + type + ": " + truncate(orNa(a.summary()), 200) + "\n");
            }
        }

        List<RetrievedArtifact> items = limit(result.get(AuthorityCategory.ROADMAP_ITEMS), ROADMAP_LIMIT);
        if (!items.isEmpty()) {
            sections.add("## ROADMAP ITEMS");
            for (RetrievedArtifact hit : items) {
                RoadmapItem ri = (RoadmapItem) hit.data();
                sections.add("- **" + ri.name() + "** (" + ri.horizon().value() + "): "
                        + truncate(orNa(ri.description()), 150) + "\n");
            }
        }

        List<RetrievedArtifact> gaps = limit(result.get(AuthorityCategory.GAPS), GAP_LIMIT);
        if (!gaps.isEmpty()) {
            sections.add("## IDENTIFIED GAPS");
            for (RetrievedArtifact hit : gaps) {
                Gap g = (Gap) hit.data();
                sections.add("- [" + g.severity() + "] " + truncate(orNa(g.description()), 150) + "\n");
            }
        }

        List<RetrievedArtifact> chunks = limit(result.get(AuthorityCategory.CHUNKS), CHUNK_LIMIT);
        if (!chunks.isEmpty()) {
            sections.add("## SOURCE EXCERPTS");
            for (RetrievedArtifact hit : chunks) {
                Chunk c = (Chunk) hit.data();
                String line = "- [" + c.lens() + "] " + truncate(orNa(c.content()), 150);
                if (hit.supersededBy() != null) {
                    line += " (superseded by " + hit.supersededBy() + ")";
                }
                sections.add(line + "\n");
            }
        }

        List<RetrievedArtifact> open = limit(result.get(AuthorityCategory.PENDING_QUESTIONS), OPEN_QUESTION_LIMIT);
        if (!open.isEmpty()) {
            sections.add("## OPEN QUESTIONS");
            for (RetrievedArtifact hit : open) {
                Question q = (Question) hit.data();
                sections.add("- [" + orNa(q.priority()) + "] " + orNa(q.text()) + "\n");
            }
        }

        return String.join("\n", sections);
    }

    private static List<RetrievedArtifact> limit(List<RetrievedArtifact> hits, int max) {
        return hits.size() > max ? hits.subList(0, max) : hits;
    }

    private static String orNa(String value) {
        return value == null || value.isEmpty() ? "N/A" : value;
    }

    private static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
