package com.assetsync.reconciler.inventory;

import java.util.Collection;
import java.util.List;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.assetsync.reconciler.model.domain.CanonicalAssetRecord;
import com.assetsync.reconciler.model.domain.IdentityKey;

import lombok.extern.slf4j.Slf4j;

/**
 * Stored records indexed by identity key, as loaded at the start of a batch.
 */
@Slf4j
public final class InventorySnapshot {

    private final Map<String, CanonicalAssetRecord> byKey = new LinkedHashMap<>();

    public InventorySnapshot(Collection<CanonicalAssetRecord> records) {
        for (CanonicalAssetRecord record : records) {
            String key = record.getIdentityKey().toString();
            if (byKey.putIfAbsent(key, record) != null) {
                log.warn("Inventory holds more than one record for {}, using #{}",
                        key, byKey.get(key).getInventoryId());
            }
        }
    }

    public static InventorySnapshot load(InventoryStoreClient store) {
        return new InventorySnapshot(store.getAll());
    }

    public static InventorySnapshot empty() {
        return new InventorySnapshot(List.of());
    }

    public Optional<CanonicalAssetRecord> find(IdentityKey key) {
        return Optional.ofNullable(byKey.get(key.toString()));
    }

    public int size() {
        return byKey.size();
    }
}
