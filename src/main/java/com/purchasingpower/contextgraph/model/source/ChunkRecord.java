package com.purchasingpower.contextgraph.model.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.contextgraph.model.artifact.Chunk;

import java.util.List;

/**
 * Row exported by the vector store: chunk fields plus its embedding vector.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChunkRecord(
        String id,
        String content,
        String lens,
        @JsonProperty("source_name") String sourceName,
        @JsonProperty("source_file") String sourceFile,
        @JsonProperty("chunk_index") int chunkIndex,
        @JsonProperty("token_count") int tokenCount,
        @JsonProperty("vector") List<Double> embedding
) {

    public Chunk toChunk() {
        return new Chunk(id, content, lens, sourceName, sourceFile, chunkIndex, tokenCount);
    }
}
