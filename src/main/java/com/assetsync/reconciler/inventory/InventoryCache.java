package com.assetsync.reconciler.inventory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

import com.assetsync.reconciler.model.domain.CanonicalAssetRecord;

import lombok.extern.slf4j.Slf4j;

/**
 * Time-bounded cache of the full asset list.
 *
 * Callers get copies so that a merge never mutates a cached record.
 * Any write to the store must call {@link #invalidate()}.
 */
@Slf4j
public class InventoryCache {

    private final Duration ttl;
    private final Clock clock;

    private List<CanonicalAssetRecord> records;
    private Instant loadedAt;

    public InventoryCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public synchronized List<CanonicalAssetRecord> get(Supplier<List<CanonicalAssetRecord>> loader) {
        Instant now = clock.instant();
        if (records == null || loadedAt.plus(ttl).isBefore(now)) {
            records = List.copyOf(loader.get());
            loadedAt = now;
            log.debug("Inventory cache loaded {} records", records.size());
        }
        return records.stream().map(CanonicalAssetRecord::copy).toList();
    }

    public synchronized void invalidate() {
        records = null;
        loadedAt = null;
    }

    public synchronized boolean isLoaded() {
        return records != null;
    }
}
