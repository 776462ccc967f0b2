package com.purchasingpower.contextgraph.source.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.configuration.ContextGraphProperties;
import com.purchasingpower.contextgraph.model.artifact.Decision;
import com.purchasingpower.contextgraph.source.DecisionStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@code {"decisions": [...]}} files.
 */
@Slf4j
@Component
public class JsonDecisionStore extends AbstractFileSource implements DecisionStore {

    private final Path decisionsFile;

    @Autowired
    public JsonDecisionStore(ObjectMapper objectMapper, ContextGraphProperties properties) {
        this(objectMapper, Paths.get(properties.getSources().getDecisionsFile()));
    }

    public JsonDecisionStore(ObjectMapper objectMapper, Path decisionsFile) {
        super(objectMapper);
        this.decisionsFile = decisionsFile;
    }

    @Override
    public List<Decision> loadDecisions() {
        return readTree(decisionsFile, "decisions")
            .map(root -> toList(root.get("decisions"), Decision.class, "decisions"))
            .orElse(List.of());
    }

    @Override
    public Optional<Instant> lastModified() {
        return lastModified(decisionsFile);
    }

    @Override
    protected Logger logger() {
        return log;
    }
}
