package com.assetsync.reconciler.model.dto;

import com.assetsync.reconciler.model.enums.RecordStatus;

/**
 * Terminal status of one identity within a sync run.
 */
public record RecordOutcome(
        String identityKey,
        RecordStatus status,
        Long inventoryId,
        String detail
) {
    public static RecordOutcome of(String identityKey, RecordStatus status, Long inventoryId) {
        return new RecordOutcome(identityKey, status, inventoryId, null);
    }

    public static RecordOutcome failed(String identityKey, String detail) {
        return new RecordOutcome(identityKey, RecordStatus.FAILED, null, detail);
    }
}
