package com.purchasingpower.contextgraph.source;

import com.purchasingpower.contextgraph.model.source.ChunkRecord;

import java.util.List;

/**
 * Read access to the chunks held by the vector store.
 */
public interface ChunkSource {

    List<ChunkRecord> loadChunks();
}
