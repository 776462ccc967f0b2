package com.purchasingpower.contextgraph.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-hop traversal request.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraverseRequest {

    @NotEmpty
    private List<String> seedIds;

    @Builder.Default
    private List<String> topicTerms = new ArrayList<>();

    @Min(0)
    @Max(10)
    @Builder.Default
    private int maxHops = 2;
}
