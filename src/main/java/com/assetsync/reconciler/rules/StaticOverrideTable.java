package com.assetsync.reconciler.rules;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.assetsync.reconciler.model.domain.StaticOverride;

/**
 * Read-only IP to override mapping. A hit short-circuits classification and
 * fixes the asset's category, name, location and placement.
 */
public final class StaticOverrideTable {

    private final Map<String, StaticOverride> byIp;

    public StaticOverrideTable(Collection<StaticOverride> overrides) {
        Map<String, StaticOverride> table = new LinkedHashMap<>();
        for (StaticOverride override : overrides) {
            String ip = override.getIp() == null ? "" : override.getIp().trim();
            if (ip.isEmpty()) {
                throw new IllegalArgumentException("Static override without IP: " + override);
            }
            if (table.putIfAbsent(ip, override) != null) {
                throw new IllegalArgumentException("Duplicate static override for IP " + ip);
            }
        }
        this.byIp = Collections.unmodifiableMap(table);
    }

    public static StaticOverrideTable empty() {
        return new StaticOverrideTable(List.of());
    }

    /**
     * Exact IP match.
     */
    public Optional<StaticOverride> find(String ip) {
        if (ip == null || ip.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byIp.get(ip.trim()));
    }

    public Collection<StaticOverride> entries() {
        return byIp.values();
    }

    public int size() {
        return byIp.size();
    }
}
