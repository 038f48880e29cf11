package com.assetsync.reconciler.config;

import java.time.Clock;
import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.assetsync.reconciler.model.domain.StaticOverride;
import com.assetsync.reconciler.model.enums.AssetCategory;
import com.assetsync.reconciler.rules.CategorizationRules;
import com.assetsync.reconciler.rules.FieldDictionary;
import com.assetsync.reconciler.rules.StaticOverrideTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds the immutable configuration values the engines are injected with.
 *
 * Rule tables, the static override table and the field dictionary are loaded
 * once here and passed explicitly; no component reads ambient global state.
 */
@Configuration
@Slf4j
public class ReconcilerConfig {

    @Bean
    public Clock reconcilerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CategorizationRules categorizationRules() {
        CategorizationRules rules = CategorizationRules.defaults();
        log.info("Loaded {} classification rules", rules.getRules().size());
        return rules;
    }

    @Bean
    public StaticOverrideTable staticOverrideTable(ReconcilerProperties properties) {
        List<StaticOverride> overrides = properties.getStaticOverrides().stream()
                .map(ReconcilerConfig::toOverride)
                .toList();
        log.info("Loaded {} static IP overrides", overrides.size());
        return new StaticOverrideTable(overrides);
    }

    @Bean
    public FieldDictionary fieldDictionary(ReconcilerProperties properties) {
        FieldDictionary dictionary = new FieldDictionary(properties.getFields());
        log.info("Field dictionary has {} fields ({})", dictionary.getFields().size(),
                dictionary.isOpen() ? "open" : "closed");
        return dictionary;
    }

    /**
     * Bounded pool for inventory writes. Distinct identity keys are written concurrently.
     * Spring initializes it and waits for in-flight writes on shutdown.
     */
    @Bean
    public ThreadPoolTaskExecutor inventoryWriteExecutor(ReconcilerProperties properties) {
        ReconcilerProperties.SyncConfig sync = properties.getSync();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sync.getParallelThreads());
        executor.setMaxPoolSize(sync.getParallelThreads());
        executor.setQueueCapacity(sync.getWriteQueueCapacity());
        executor.setThreadNamePrefix("inventory-writer-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(sync.getWriteTimeoutSeconds());
        log.info("Inventory writer pool: {} threads, queue {}", sync.getParallelThreads(),
                sync.getWriteQueueCapacity());
        return executor;
    }

    static StaticOverride toOverride(ReconcilerProperties.StaticOverrideEntry entry) {
        AssetCategory category = AssetCategory.fromLabel(entry.getCategory())
                .or(() -> AssetCategory.fromLabel(entry.getDeviceType()))
                .orElseThrow(() -> new IllegalStateException(
                        "Static override " + entry.getIp() + " has unknown category '"
                                + entry.getCategory() + "'"));

        return StaticOverride.builder()
                .ip(entry.getIp())
                .deviceType(entry.getDeviceType())
                .category(category)
                .name(entry.getName())
                .location(entry.getLocation())
                .placement(entry.getPlacement())
                .services(entry.getServices())
                .build();
    }
}
