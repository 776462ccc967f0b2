package com.purchasingpower.contextgraph.source.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.configuration.ContextGraphProperties;
import com.purchasingpower.contextgraph.model.source.ChunkRecord;
import com.purchasingpower.contextgraph.source.ChunkSource;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Reads a JSON array export of the vector store table.
 */
@Slf4j
@Component
public class JsonChunkSource extends AbstractFileSource implements ChunkSource {

    private final Path chunksFile;

    @Autowired
    public JsonChunkSource(ObjectMapper objectMapper, ContextGraphProperties properties) {
        this(objectMapper, Paths.get(properties.getSources().getChunksFile()));
    }

    public JsonChunkSource(ObjectMapper objectMapper, Path chunksFile) {
        super(objectMapper);
        this.chunksFile = chunksFile;
    }

    @Override
    public List<ChunkRecord> loadChunks() {
        return readTree(chunksFile, "chunks")
            .map(root -> toList(root, ChunkRecord.class, "chunks"))
            .orElse(List.of());
    }

    @Override
    protected Logger logger() {
        return log;
    }
}
