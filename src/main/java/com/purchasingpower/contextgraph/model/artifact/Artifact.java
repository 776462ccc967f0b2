package com.purchasingpower.contextgraph.model.artifact;

import com.purchasingpower.contextgraph.core.ArtifactType;

/**
 * Base interface for every record held in the entity index.
 *
 * <p>Each artifact type is a dedicated record; callers switch on {@link #artifactType()}
 * instead of probing field maps.
 *
 * @since 1.0.0
 */
public interface Artifact {

    /**
     * Stable external identifier, unique within the graph.
     */
    String id();

    ArtifactType artifactType();
}
