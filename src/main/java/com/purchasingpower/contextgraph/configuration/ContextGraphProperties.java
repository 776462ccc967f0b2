package com.purchasingpower.contextgraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

/**
 * Root configuration bound from the {@code app.graph} namespace.
 *
 * <pre>
 * app:
 *   graph:
 *     storage-dir: data/unified_graph
 *     sources:
 *       roadmap-file: output/master_roadmap.md
 *     inference:
 *       supported-by-threshold: 0.75
 *     retrieval:
 *       matcher: keyword
 *     embedding:
 *       base-url: http://localhost:11434
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.graph")
public class ContextGraphProperties {

    @NotBlank(message = "Graph storage directory is required")
    private String storageDir = "data/unified_graph";

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SourceProperties sources = new SourceProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private InferenceProperties inference = new InferenceProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RetrievalProperties retrieval = new RetrievalProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private EmbeddingProperties embedding = new EmbeddingProperties();
}
