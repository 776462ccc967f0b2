package com.purchasingpower.contextgraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for the read endpoints (traverse, stats, superseding decision), so failures carry
 * an error message like the sync and query responses do.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphDataResponse<T> {

    private boolean success;
    private String error;
    private T data;

    public static <T> GraphDataResponse<T> success(T data) {
        return GraphDataResponse.<T>builder()
            .success(true)
            .data(data)
            .build();
    }

    public static <T> GraphDataResponse<T> error(String error) {
        return GraphDataResponse.<T>builder()
            .success(false)
            .error(error)
            .build();
    }
}
