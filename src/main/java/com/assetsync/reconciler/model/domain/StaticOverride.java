package com.assetsync.reconciler.model.domain;

import com.assetsync.reconciler.model.enums.AssetCategory;

import lombok.Builder;
import lombok.Value;

/**
 * One entry of the manually curated IP override table.
 */
@Value
@Builder
public class StaticOverride {

    String ip;

    /**
     * Device type as written in the table (e.g. "Firewall", "Server").
     */
    String deviceType;

    AssetCategory category;

    String name;

    String location;

    /**
     * Specific placement, e.g. rack unit or room.
     */
    String placement;

    String services;
}
