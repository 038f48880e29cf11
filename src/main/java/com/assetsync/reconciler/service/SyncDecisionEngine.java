package com.assetsync.reconciler.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import com.assetsync.reconciler.config.ReconcilerProperties;
import com.assetsync.reconciler.inventory.InventorySnapshot;
import com.assetsync.reconciler.inventory.InventoryStoreClient;
import com.assetsync.reconciler.model.domain.CanonicalAssetRecord;
import com.assetsync.reconciler.model.domain.FieldValue;
import com.assetsync.reconciler.model.dto.RecordOutcome;
import com.assetsync.reconciler.model.dto.SyncDecision;
import com.assetsync.reconciler.model.dto.SyncOutcome;
import com.assetsync.reconciler.model.enums.RecordStatus;
import com.assetsync.reconciler.model.enums.SourceType;
import com.assetsync.reconciler.model.enums.SyncAction;
import com.assetsync.reconciler.rules.FieldDictionary;
import com.assetsync.reconciler.util.AssetTags;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides, per identity key, whether a merged record is created, updated or
 * skipped, and issues the resulting writes.
 *
 * Writes for distinct keys run on the bounded writer pool. A failing or
 * timed-out write fails that record only; the rest of the batch proceeds.
 */
@Service
@Slf4j
public class SyncDecisionEngine {

    private final InventoryStoreClient inventoryStore;
    private final FieldMergeResolver mergeResolver;
    private final TaskExecutor writeExecutor;
    private final ReconcilerProperties properties;
    private final Clock clock;

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public SyncDecisionEngine(
            InventoryStoreClient inventoryStore,
            FieldMergeResolver mergeResolver,
            @Qualifier("inventoryWriteExecutor") TaskExecutor writeExecutor,
            ReconcilerProperties properties,
            Clock clock) {
        this.inventoryStore = inventoryStore;
        this.mergeResolver = mergeResolver;
        this.writeExecutor = writeExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Plan the writes for a batch without performing any.
     *
     * Records sharing an identity key are folded into one, in first-seen order,
     * so at most one decision exists per key.
     */
    public List<SyncDecision> plan(List<CanonicalAssetRecord> batch, InventorySnapshot snapshot) {
        Map<String, CanonicalAssetRecord> byKey = new LinkedHashMap<>();
        for (CanonicalAssetRecord record : batch) {
            byKey.merge(record.getIdentityKey().toString(), record, mergeResolver::mergeRecords);
        }

        List<SyncDecision> decisions = new ArrayList<>(byKey.size());
        for (CanonicalAssetRecord record : byKey.values()) {
            CanonicalAssetRecord stored = snapshot.find(record.getIdentityKey()).orElse(null);
            if (stored == null) {
                decisions.add(new SyncDecision(SyncAction.CREATE, record, null));
            } else if (record.contentEquals(stored)) {
                decisions.add(new SyncDecision(SyncAction.SKIP, record, stored));
            } else {
                CanonicalAssetRecord update = record.copy();
                if (update.getInventoryId() == null) {
                    update.setInventoryId(stored.getInventoryId());
                }
                decisions.add(new SyncDecision(SyncAction.UPDATE, update, stored));
            }
        }
        return decisions;
    }

    /**
     * Plan and execute a batch into a fresh outcome.
     */
    public SyncOutcome decide(SourceType source, List<CanonicalAssetRecord> batch, InventorySnapshot snapshot) {
        SyncOutcome outcome = new SyncOutcome(source, clock.instant());
        execute(plan(batch, snapshot), outcome);
        outcome.complete(clock.instant());
        return outcome;
    }

    /**
     * Issue the planned writes and record one terminal status per decision.
     * Returns when every decision has a status.
     */
    public void execute(List<SyncDecision> decisions, SyncOutcome outcome) {
        int timeoutSeconds = properties.getSync().getWriteTimeoutSeconds();
        List<PendingWrite> pending = new ArrayList<>();

        for (SyncDecision decision : decisions) {
            if (decision.action() == SyncAction.SKIP) {
                outcome.record(RecordOutcome.of(decision.identityKey(), RecordStatus.SKIPPED,
                        decision.stored().getInventoryId()));
                continue;
            }
            pending.add(new PendingWrite(decision, submit(decision, timeoutSeconds)));
        }

        for (PendingWrite write : pending) {
            outcome.record(write.result()
                    .handle((result, error) -> error == null ? result : failure(write.decision(), error, timeoutSeconds))
                    .join());
        }
    }

    /**
     * Stop starting new writes. Writes already in flight complete normally.
     */
    public void requestCancel() {
        if (!cancelRequested.getAndSet(true)) {
            log.warn("Cancellation requested, no further inventory writes will be started");
        }
    }

    public void resetCancellation() {
        cancelRequested.set(false);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    private CompletableFuture<RecordOutcome> submit(SyncDecision decision, int timeoutSeconds) {
        CompletableFuture<RecordOutcome> result = new CompletableFuture<>();
        try {
            writeExecutor.execute(() -> {
                if (cancelRequested.get()) {
                    result.complete(RecordOutcome.failed(decision.identityKey(), "cancelled"));
                    return;
                }
                // the clock starts when the write starts, not while it waits in the queue
                result.orTimeout(timeoutSeconds, TimeUnit.SECONDS);
                try {
                    result.complete(write(decision));
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    private RecordOutcome write(SyncDecision decision) {
        CanonicalAssetRecord record = decision.record();

        if (decision.action() == SyncAction.CREATE) {
            ensureAssetTag(record);
            long id = inventoryStore.create(record);
            record.setInventoryId(id);
            log.debug("Created {} as #{}", decision.identityKey(), id);
            return RecordOutcome.of(decision.identityKey(), RecordStatus.CREATED, id);
        }

        Long id = record.getInventoryId();
        if (id == null) {
            return RecordOutcome.failed(decision.identityKey(), "stored record has no inventory id");
        }
        inventoryStore.update(id, record);
        log.debug("Updated {} (#{})", decision.identityKey(), id);
        return RecordOutcome.of(decision.identityKey(), RecordStatus.UPDATED, id);
    }

    private void ensureAssetTag(CanonicalAssetRecord record) {
        if (record.fieldValue(FieldDictionary.ASSET_TAG) != null) {
            return;
        }
        Instant now = clock.instant();
        String tag = AssetTags.generate(record.getIdentityKey().toString(), now);
        record.getFields().put(FieldDictionary.ASSET_TAG, new FieldValue(tag, record.getLastUpdateSource(), now));
    }

    private RecordOutcome failure(SyncDecision decision, Throwable error, int timeoutSeconds) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;

        String detail;
        if (cause instanceof TimeoutException) {
            detail = "write timed out after " + timeoutSeconds + "s";
        } else if (cause instanceof RejectedExecutionException) {
            detail = "writer pool unavailable";
        } else {
            detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
        log.warn("{} of {} failed: {}", decision.action(), decision.identityKey(), detail);
        return RecordOutcome.failed(decision.identityKey(), detail);
    }

    private record PendingWrite(SyncDecision decision, CompletableFuture<RecordOutcome> result) {
    }
}
