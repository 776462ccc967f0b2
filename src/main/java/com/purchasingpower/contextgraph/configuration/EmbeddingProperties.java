package com.purchasingpower.contextgraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Embedding service connection. Timeout and retries bound how long a sync can stall on it.
 */
@Data
public class EmbeddingProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String model = "mxbai-embed-large";

    @Min(1)
    private int timeoutSeconds = 120;

    @Min(0)
    private int maxRetries = 3;

    @Min(1)
    private int batchSize = 64;
}
