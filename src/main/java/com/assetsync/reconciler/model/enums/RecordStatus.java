package com.assetsync.reconciler.model.enums;

/**
 * Lifecycle of a record within one sync run.
 */
public enum RecordStatus {

    NEW,
    CLASSIFIED,
    MERGED,

    // Terminal states
    CREATED,
    UPDATED,
    SKIPPED,
    FAILED;

    public boolean isTerminal() {
        return ordinal() >= CREATED.ordinal();
    }
}
