package com.purchasingpower.contextgraph.source.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.configuration.ContextGraphProperties;
import com.purchasingpower.contextgraph.configuration.SourceProperties;
import com.purchasingpower.contextgraph.exception.SourceUnavailableException;
import com.purchasingpower.contextgraph.source.AssessmentSource;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads the architecture alignment object and the array of competitive analyst assessments.
 */
@Slf4j
@Component
public class JsonAssessmentSource extends AbstractFileSource implements AssessmentSource {

    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {
    };

    private final Path architectureFile;
    private final Path competitiveFile;

    @Autowired
    public JsonAssessmentSource(ObjectMapper objectMapper, ContextGraphProperties properties) {
        this(objectMapper, properties.getSources());
    }

    private JsonAssessmentSource(ObjectMapper objectMapper, SourceProperties sources) {
        this(objectMapper,
            Paths.get(sources.getArchitectureAssessmentFile()),
            Paths.get(sources.getCompetitiveAssessmentsFile()));
    }

    public JsonAssessmentSource(ObjectMapper objectMapper, Path architectureFile, Path competitiveFile) {
        super(objectMapper);
        this.architectureFile = architectureFile;
        this.competitiveFile = competitiveFile;
    }

    @Override
    public Optional<Map<String, Object>> loadArchitectureAssessment() {
        return readTree(architectureFile, "architecture assessment")
            .filter(node -> !node.isNull() && node.size() > 0)
            .map(node -> {
                if (!node.isObject()) {
                    throw new SourceUnavailableException("architecture assessment", "expected a JSON object", null);
                }
                return objectMapper.convertValue(node, PAYLOAD);
            });
    }

    @Override
    public List<Map<String, Object>> loadCompetitiveAssessments() {
        Optional<JsonNode> root = readTree(competitiveFile, "competitive assessments");
        if (root.isEmpty() || root.get().isNull()) {
            return List.of();
        }
        if (!root.get().isArray()) {
            throw new SourceUnavailableException("competitive assessments", "expected a JSON array", null);
        }
        List<Map<String, Object>> assessments = new ArrayList<>();
        for (JsonNode node : root.get()) {
            if (node.isObject()) {
                assessments.add(objectMapper.convertValue(node, PAYLOAD));
            } else {
                log.warn("⚠️  Ignoring non-object entry in {}", competitiveFile);
            }
        }
        return assessments;
    }

    @Override
    public Optional<Instant> lastModified() {
        return Stream.of(lastModified(architectureFile), lastModified(competitiveFile))
            .flatMap(Optional::stream)
            .max(Instant::compareTo);
    }

    @Override
    protected Logger logger() {
        return log;
    }
}
