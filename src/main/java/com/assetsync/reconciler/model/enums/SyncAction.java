package com.assetsync.reconciler.model.enums;

/**
 * Write the decision engine asks the inventory store to perform.
 */
public enum SyncAction {

    /**
     * No record with this identity exists in the store
     */
    CREATE,

    /**
     * A record exists and at least one value differs
     */
    UPDATE,

    /**
     * Stored record is identical; no write issued
     */
    SKIP
}
