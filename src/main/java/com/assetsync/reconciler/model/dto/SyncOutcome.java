package com.assetsync.reconciler.model.dto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.assetsync.reconciler.model.enums.RecordStatus;
import com.assetsync.reconciler.model.enums.SourceType;

import lombok.Getter;

/**
 * Aggregate result of one sync run for one source.
 *
 * Created at the start of a run, filled per record (possibly from several
 * writer threads), finalized at the end and handed to the caller.
 */
@Getter
public class SyncOutcome {

    private final SourceType source;
    private final Instant startedAt;
    private Instant completedAt;

    private int created;
    private int updated;
    private int skipped;
    private int failed;

    /**
     * Set when the whole batch was aborted (acquisition or snapshot failure).
     */
    private String error;

    private final List<RecordOutcome> records = new ArrayList<>();

    public SyncOutcome(SourceType source, Instant startedAt) {
        this.source = source;
        this.startedAt = startedAt;
    }

    public static SyncOutcome aborted(SourceType source, Instant startedAt, String error) {
        SyncOutcome outcome = new SyncOutcome(source, startedAt);
        outcome.error = error;
        outcome.completedAt = startedAt;
        return outcome;
    }

    public synchronized void record(RecordOutcome outcome) {
        switch (outcome.status()) {
            case CREATED -> created++;
            case UPDATED -> updated++;
            case SKIPPED -> skipped++;
            case FAILED -> failed++;
            default -> throw new IllegalArgumentException(
                    "Non-terminal status in outcome: " + outcome.status());
        }
        records.add(outcome);
    }

    public synchronized void complete(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public synchronized void abort(String error, Instant completedAt) {
        this.error = error;
        this.completedAt = completedAt;
    }

    public boolean isAborted() {
        return error != null;
    }

    public synchronized List<RecordOutcome> getRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public synchronized List<RecordOutcome> recordsWithStatus(RecordStatus status) {
        return records.stream().filter(r -> r.status() == status).toList();
    }

    public synchronized SyncResult toResult() {
        return new SyncResult(created, updated, failed, skipped);
    }

    public String summary() {
        return String.format("%s sync: %d created, %d updated, %d skipped, %d failed%s",
                source, created, updated, skipped, failed,
                error != null ? " (aborted: " + error + ")" : "");
    }
}
