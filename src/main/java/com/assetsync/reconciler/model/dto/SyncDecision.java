package com.assetsync.reconciler.model.dto;

import com.assetsync.reconciler.model.domain.CanonicalAssetRecord;
import com.assetsync.reconciler.model.enums.SyncAction;

/**
 * Planned write for one identity key.
 *
 * @param record  merged record to persist
 * @param stored  record currently in the store, null for creates
 */
public record SyncDecision(SyncAction action, CanonicalAssetRecord record, CanonicalAssetRecord stored) {

    public String identityKey() {
        return record.getIdentityKey().toString();
    }
}
