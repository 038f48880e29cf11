package com.assetsync.reconciler.model.enums;

import java.util.Locale;

import com.assetsync.reconciler.exception.UnknownSourceException;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Discovery and management sources that feed the reconciler.
 */
@Getter
@RequiredArgsConstructor
public enum SourceType {

    /**
     * Manually curated IP override table
     */
    STATIC("Static Mapping", "Static Mapping"),

    /**
     * Mobile device management inventory API
     */
    MDM("MDM Inventory", "Managed (MDM)"),

    /**
     * SNMP polling across a subnet
     */
    SNMP("SNMP Poller", "On-Premise"),

    /**
     * Network port scanning
     */
    SCAN("Port Scan", "Discovered (Scan)");

    /**
     * Display name for the source
     */
    private final String displayName;

    /**
     * Inventory status label assigned to assets last reported by this source
     */
    private final String statusLabel;

    /**
     * Parse a source name as it appears in URLs and configuration.
     *
     * @throws UnknownSourceException if the name matches no source
     */
    public static SourceType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnknownSourceException(String.valueOf(name));
        }
        String key = name.trim().toUpperCase(Locale.ROOT);
        for (SourceType type : values()) {
            if (type.name().equals(key)) {
                return type;
            }
        }
        throw new UnknownSourceException(name);
    }
}
