package com.assetsync.reconciler.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.stereotype.Service;

import com.assetsync.reconciler.adapter.SourceAdapter;
import com.assetsync.reconciler.adapter.SourceCollaborator;
import com.assetsync.reconciler.config.ReconcilerProperties;
import com.assetsync.reconciler.exception.AcquisitionException;
import com.assetsync.reconciler.exception.MergeConflictException;
import com.assetsync.reconciler.exception.UnknownSourceException;
import com.assetsync.reconciler.inventory.InventorySnapshot;
import com.assetsync.reconciler.inventory.InventoryStoreClient;
import com.assetsync.reconciler.model.domain.CanonicalAssetRecord;
import com.assetsync.reconciler.model.domain.Classification;
import com.assetsync.reconciler.model.domain.IdentityKey;
import com.assetsync.reconciler.model.domain.RawDeviceRecord;
import com.assetsync.reconciler.model.domain.ResolvedIdentity;
import com.assetsync.reconciler.model.dto.RecordOutcome;
import com.assetsync.reconciler.model.dto.SyncOutcome;
import com.assetsync.reconciler.model.enums.SourceType;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs source batches through identity resolution, categorization, merge and
 * the sync decision.
 *
 * Only one batch is processed at a time; concurrent callers queue on a fair
 * lock in arrival order. No exception escapes a batch: every problem ends up
 * in the returned {@link SyncOutcome}.
 */
@Service
@Slf4j
public class ReconciliationService {

    private final IdentityResolver identityResolver;
    private final CategorizationEngine categorizationEngine;
    private final FieldMergeResolver mergeResolver;
    private final SyncDecisionEngine decisionEngine;
    private final InventoryStoreClient inventoryStore;
    private final Map<SourceType, SourceAdapter> sourceAdapters;
    private final Map<SourceType, SourceCollaborator> sourceCollaborators;
    private final ReconcilerProperties properties;
    private final Clock clock;

    static final String UNRESOLVED_KEY = "unresolved";

    private final ReentrantLock runLock = new ReentrantLock(true);
    private final Map<SourceType, SyncOutcome> lastOutcomes = Collections.synchronizedMap(new EnumMap<>(SourceType.class));
    private final Map<SourceType, Instant> lastSuccess = Collections.synchronizedMap(new EnumMap<>(SourceType.class));

    public ReconciliationService(
            IdentityResolver identityResolver,
            CategorizationEngine categorizationEngine,
            FieldMergeResolver mergeResolver,
            SyncDecisionEngine decisionEngine,
            InventoryStoreClient inventoryStore,
            Map<SourceType, SourceAdapter> sourceAdapters,
            Map<SourceType, SourceCollaborator> sourceCollaborators,
            ReconcilerProperties properties,
            Clock clock) {
        this.identityResolver = identityResolver;
        this.categorizationEngine = categorizationEngine;
        this.mergeResolver = mergeResolver;
        this.decisionEngine = decisionEngine;
        this.inventoryStore = inventoryStore;
        this.sourceAdapters = sourceAdapters;
        this.sourceCollaborators = sourceCollaborators;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Reconcile one batch of raw records from a source against the inventory.
     */
    public SyncOutcome reconcile(SourceType source, List<RawDeviceRecord> records) {
        runLock.lock();
        try {
            decisionEngine.resetCancellation();
            Instant startedAt = clock.instant();
            SyncOutcome outcome = new SyncOutcome(source, startedAt);

            log.info("Starting {} sync of {} records", source, records.size());

            InventorySnapshot snapshot;
            try {
                snapshot = InventorySnapshot.load(inventoryStore);
            } catch (Exception e) {
                log.error("{} sync aborted, inventory snapshot unavailable: {}", source, e.getMessage());
                outcome.abort("inventory snapshot unavailable: " + e.getMessage(), clock.instant());
                return finish(outcome);
            }

            // a repeated identity merges onto its earlier occurrence in this batch, not the stored record
            Map<IdentityKey, CanonicalAssetRecord> latest = new HashMap<>();
            List<CanonicalAssetRecord> merged = new ArrayList<>(records.size());
            for (RawDeviceRecord record : records) {
                mergeOne(record, snapshot, latest, outcome).ifPresent(result -> {
                    latest.put(result.getIdentityKey(), result);
                    merged.add(result);
                });
            }

            try {
                decisionEngine.execute(decisionEngine.plan(merged, snapshot), outcome);
                outcome.complete(clock.instant());
            } catch (Exception e) {
                log.error("{} sync aborted while writing: {}", source, e.getMessage(), e);
                outcome.abort("write phase failed: " + e.getMessage(), clock.instant());
            }
            return finish(outcome);

        } finally {
            runLock.unlock();
        }
    }

    /**
     * Adapt records pushed in a source's native shape and reconcile them.
     *
     * @throws UnknownSourceException if no adapter exists for the source
     * @throws AcquisitionException if a native record cannot be read
     */
    public SyncOutcome reconcileNative(SourceType source, List<Map<String, Object>> nativeRecords) {
        SourceAdapter adapter = sourceAdapters.get(source);
        if (adapter == null) {
            throw new UnknownSourceException(source.name());
        }
        return reconcile(source, adapter.adapt(nativeRecords, clock.instant()));
    }

    /**
     * Pull a source's records since its last successful run and reconcile them.
     */
    public SyncOutcome ingest(SourceType source, SourceCollaborator collaborator) {
        Instant startedAt = clock.instant();
        Instant since = lastSuccess.get(source);

        SourceAdapter adapter = sourceAdapters.get(source);
        if (adapter == null) {
            log.error("No adapter registered for source {}", source);
            return finish(SyncOutcome.aborted(source, startedAt, "no adapter for " + source));
        }

        List<RawDeviceRecord> records;
        try {
            records = adapter.adapt(collaborator.fetchSince(since), startedAt);
        } catch (Exception e) {
            log.error("{} acquisition failed: {}", source, e.getMessage());
            return finish(SyncOutcome.aborted(source, startedAt, "acquisition failed: " + e.getMessage()));
        }

        SyncOutcome outcome = reconcile(source, records);
        if (!outcome.isAborted()) {
            lastSuccess.put(source, startedAt);
        }
        return outcome;
    }

    /**
     * Ingest every source that has a collaborator, in the configured source order.
     * Later sources win when two report different values for the same field.
     */
    public Map<SourceType, SyncOutcome> runAll() {
        Map<SourceType, SyncOutcome> outcomes = new LinkedHashMap<>();
        for (SourceType source : properties.getSync().getSourceOrder()) {
            SourceCollaborator collaborator = sourceCollaborators.get(source);
            if (collaborator == null) {
                log.debug("No collaborator for {}, skipping", source);
                continue;
            }
            if (decisionEngine.isCancelRequested() && !outcomes.isEmpty()) {
                log.warn("Full run cancelled before {}", source);
                break;
            }
            outcomes.put(source, ingest(source, collaborator));
        }
        return outcomes;
    }

    /**
     * Ask the running batch to stop starting new writes.
     */
    public void cancel() {
        decisionEngine.requestCancel();
    }

    public Map<SourceType, SyncOutcome> getLastOutcomes() {
        synchronized (lastOutcomes) {
            return new LinkedHashMap<>(lastOutcomes);
        }
    }

    public Optional<Instant> getLastSuccess(SourceType source) {
        return Optional.ofNullable(lastSuccess.get(source));
    }

    private Optional<CanonicalAssetRecord> mergeOne(
            RawDeviceRecord record,
            InventorySnapshot snapshot,
            Map<IdentityKey, CanonicalAssetRecord> latest,
            SyncOutcome outcome) {

        String key = UNRESOLVED_KEY;
        try {
            ResolvedIdentity identity = identityResolver.resolve(record);
            key = identity.key().toString();
            Classification classification = categorizationEngine.classify(record, identity);
            CanonicalAssetRecord existing = latest.containsKey(identity.key())
                    ? latest.get(identity.key())
                    : snapshot.find(identity.key()).orElse(null);
            return Optional.of(mergeResolver.merge(existing, record, identity, classification));

        } catch (MergeConflictException e) {
            log.warn("Merge conflict for {}: {}", key, e.getMessage());
            outcome.record(RecordOutcome.failed(key, e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Could not merge {}: {}", key, e.getMessage(), e);
            outcome.record(RecordOutcome.failed(key, "merge failed: " + e.getMessage()));
        }
        return Optional.empty();
    }

    private SyncOutcome finish(SyncOutcome outcome) {
        log.info(outcome.summary());
        lastOutcomes.put(outcome.getSource(), outcome);
        return outcome;
    }
}
