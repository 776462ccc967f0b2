package com.purchasingpower.contextgraph.model.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.contextgraph.core.ArtifactType;

/**
 * Source excerpt produced by the chunking collaborator. The embedding is kept on the graph
 * node, not on the record.
 *
 * @param lens origin tag carried as metadata only
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Chunk(
        String id,
        String content,
        String lens,
        @JsonProperty("source_name") String sourceName,
        @JsonProperty("source_file") String sourceFile,
        @JsonProperty("chunk_index") int chunkIndex,
        @JsonProperty("token_count") int tokenCount
) implements Artifact {

    public Chunk {
        content = content != null ? content : "";
        lens = lens != null && !lens.isBlank() ? lens : "unknown";
        sourceName = sourceName != null ? sourceName : "";
        sourceFile = sourceFile != null ? sourceFile : "";
    }

    @Override
    public ArtifactType artifactType() {
        return ArtifactType.CHUNK;
    }
}
