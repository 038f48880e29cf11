package com.assetsync.reconciler.model.dto;

import java.time.Instant;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * REST view of a finished sync run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncRunResponse {

    private String source;

    private SyncResult result;

    private String error;

    private Instant startedAt;

    private Instant completedAt;

    private List<RecordOutcome> records;

    public static SyncRunResponse from(SyncOutcome outcome) {
        return SyncRunResponse.builder()
                .source(outcome.getSource().name())
                .result(outcome.toResult())
                .error(outcome.getError())
                .startedAt(outcome.getStartedAt())
                .completedAt(outcome.getCompletedAt())
                .records(outcome.getRecords())
                .build();
    }
}
