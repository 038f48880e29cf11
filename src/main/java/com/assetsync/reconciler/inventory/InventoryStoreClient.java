package com.assetsync.reconciler.inventory;

import java.util.List;
import java.util.Optional;

import com.assetsync.reconciler.exception.InventoryStoreException;
import com.assetsync.reconciler.model.domain.CanonicalAssetRecord;
import com.assetsync.reconciler.model.domain.IdentityKey;

/**
 * Downstream inventory store holding one canonical record per identity key.
 *
 * Every call may throw {@link InventoryStoreException}.
 */
public interface InventoryStoreClient {

    /**
     * All stored records. Used to build the snapshot a batch is decided against.
     */
    List<CanonicalAssetRecord> getAll();

    Optional<CanonicalAssetRecord> getByIdentity(IdentityKey key);

    /**
     * Persist a new record.
     *
     * @return the id assigned by the store
     */
    long create(CanonicalAssetRecord record);

    void update(long inventoryId, CanonicalAssetRecord record);

    /**
     * Whether the store currently answers requests.
     */
    boolean isAvailable();
}
