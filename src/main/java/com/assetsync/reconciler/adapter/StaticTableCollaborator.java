package com.assetsync.reconciler.adapter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.assetsync.reconciler.model.domain.StaticOverride;
import com.assetsync.reconciler.model.enums.SourceType;
import com.assetsync.reconciler.rules.StaticOverrideTable;

import lombok.RequiredArgsConstructor;

/**
 * Serves the in-process static table as a source. The table has no change
 * history, so every fetch returns all entries; unchanged ones end up skipped.
 */
@Component
@RequiredArgsConstructor
public class StaticTableCollaborator implements SourceCollaborator {

    private final StaticOverrideTable staticOverrideTable;

    @Override
    public SourceType getSourceType() {
        return SourceType.STATIC;
    }

    @Override
    public List<Map<String, Object>> fetchSince(Instant since) {
        return staticOverrideTable.entries().stream()
                .map(StaticTableCollaborator::toNative)
                .toList();
    }

    private static Map<String, Object> toNative(StaticOverride override) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("ip", override.getIp());
        entry.put("name", override.getName());
        entry.put("device_type", override.getDeviceType());
        entry.put("category", override.getCategory().getInventoryLabel());
        entry.put("location", override.getLocation());
        entry.put("placement", override.getPlacement());
        entry.put("services", override.getServices());
        return entry;
    }
}
