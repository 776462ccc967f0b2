package com.purchasingpower.contextgraph.api;

import com.purchasingpower.contextgraph.model.sync.SyncResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sync/rebuild response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResponse {

    private boolean success;
    private String error;
    private String summary;
    private SyncResult result;

    public static SyncResponse success(SyncResult result) {
        return SyncResponse.builder()
            .success(result.isSuccess())
            .summary(result.summary())
            .result(result)
            .build();
    }

    public static SyncResponse error(String error) {
        return SyncResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
