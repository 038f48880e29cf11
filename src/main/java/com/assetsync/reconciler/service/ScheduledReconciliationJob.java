package com.assetsync.reconciler.service;

import java.util.Map;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.assetsync.reconciler.config.ReconcilerProperties;
import com.assetsync.reconciler.model.dto.SyncOutcome;
import com.assetsync.reconciler.model.enums.SourceType;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodic full run over all pullable sources. Does nothing unless
 * {@code assetsync.reconciler.sync.scheduled-enabled} is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduledReconciliationJob {

    private final ReconciliationService reconciliationService;
    private final ReconcilerProperties properties;

    @Scheduled(cron = "${assetsync.reconciler.sync.schedule-cron:0 0 2 * * ?}")
    public void runScheduled() {
        if (!properties.getSync().isScheduledEnabled()) {
            log.trace("Scheduled sync disabled");
            return;
        }

        log.info("Scheduled sync starting");
        Map<SourceType, SyncOutcome> outcomes = reconciliationService.runAll();
        long aborted = outcomes.values().stream().filter(SyncOutcome::isAborted).count();
        log.info("Scheduled sync finished: {} sources, {} aborted", outcomes.size(), aborted);
    }
}
