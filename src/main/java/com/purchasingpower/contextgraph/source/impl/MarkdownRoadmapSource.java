package com.purchasingpower.contextgraph.source.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.configuration.ContextGraphProperties;
import com.purchasingpower.contextgraph.source.RoadmapSource;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Component
public class MarkdownRoadmapSource extends AbstractFileSource implements RoadmapSource {

    private final Path roadmapFile;

    @Autowired
    public MarkdownRoadmapSource(ObjectMapper objectMapper, ContextGraphProperties properties) {
        this(objectMapper, Paths.get(properties.getSources().getRoadmapFile()));
    }

    public MarkdownRoadmapSource(ObjectMapper objectMapper, Path roadmapFile) {
        super(objectMapper);
        this.roadmapFile = roadmapFile;
    }

    @Override
    public Optional<String> readRoadmap() {
        return readText(roadmapFile, "roadmap");
    }

    @Override
    public Optional<Instant> lastModified() {
        return lastModified(roadmapFile);
    }

    @Override
    protected Logger logger() {
        return log;
    }
}
