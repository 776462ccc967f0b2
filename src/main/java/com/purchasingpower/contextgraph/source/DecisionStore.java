package com.purchasingpower.contextgraph.source;

import com.purchasingpower.contextgraph.model.artifact.Decision;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DecisionStore {

    List<Decision> loadDecisions();

    default Optional<Instant> lastModified() {
        return Optional.empty();
    }
}
