package com.assetsync.reconciler.model.dto;

/**
 * Externally visible result of a sync invocation.
 */
public record SyncResult(int created, int updated, int failed, int skipped) {

    public static SyncResult empty() {
        return new SyncResult(0, 0, 0, 0);
    }

    public int processed() {
        return created + updated + failed + skipped;
    }
}
