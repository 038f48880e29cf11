package com.assetsync.reconciler.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.assetsync.reconciler.model.enums.FieldType;
import com.assetsync.reconciler.model.enums.SourceType;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

/**
 * Configuration properties for the asset reconciler.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "assetsync.reconciler")
public class ReconcilerProperties {

    /**
     * Sync run configuration
     */
    @Valid
    private SyncConfig sync = new SyncConfig();

    /**
     * Downstream inventory store configuration
     */
    @Valid
    private InventoryConfig inventory = new InventoryConfig();

    /**
     * Manually curated IP overrides. Highest classification priority.
     */
    @Valid
    private List<StaticOverrideEntry> staticOverrides = new ArrayList<>();

    /**
     * Custom field dictionary supplied by the inventory store (field name -> type).
     * Empty means any attribute is accepted as text.
     */
    private Map<String, FieldType> fields = new LinkedHashMap<>();

    @Data
    public static class SyncConfig {
        /**
         * Number of parallel threads issuing inventory writes
         */
        @Min(1)
        private int parallelThreads = 4;

        /**
         * Timeout for a single create/update call in seconds
         */
        @Min(1)
        private int writeTimeoutSeconds = 30;

        /**
         * Writes waiting for a free writer thread. A write that does not fit fails its record.
         */
        @Min(1)
        private int writeQueueCapacity = 10_000;

        /**
         * Order in which sources are ingested by a full run. Later sources win
         * when two sources report different values for the same field.
         */
        @NotEmpty
        private List<SourceType> sourceOrder = new ArrayList<>(
                List.of(SourceType.STATIC, SourceType.SNMP, SourceType.SCAN, SourceType.MDM));

        /**
         * Enable scheduled sync jobs
         */
        private boolean scheduledEnabled = false;

        /**
         * Cron expression for scheduled sync (default: daily at 2 AM)
         */
        private String scheduleCron = "0 0 2 * * ?";
    }

    @Data
    public static class InventoryConfig {
        /**
         * Inventory store API base URL
         */
        @NotBlank
        private String apiUrl = "http://localhost:8000";

        /**
         * API token for the inventory store
         */
        private String apiToken;

        /**
         * Asset collection path
         */
        private String assetsPath = "/api/v1/hardware";

        /**
         * Time to live of the cached asset list in seconds
         */
        private int cacheTtlSeconds = 300;

        /**
         * Read timeout in seconds
         */
        @Min(1)
        private int readTimeout = 30;
    }

    @Data
    public static class StaticOverrideEntry {
        @NotBlank
        private String ip;
        private String deviceType;
        private String category;
        private String name;
        private String location;
        private String placement;
        private String services;
    }
}
