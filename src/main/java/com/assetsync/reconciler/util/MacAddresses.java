package com.assetsync.reconciler.util;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * MAC address handling shared by all sources.
 *
 * Canonical form is upper-case and colon separated ({@code AA:BB:CC:DD:EE:FF}).
 */
public final class MacAddresses {

    private static final Pattern SEPARATORS = Pattern.compile("[:\\-.\\s]");
    private static final Pattern LIST_SPLIT = Pattern.compile("[\\s,;]+");
    private static final Pattern HEX12 = Pattern.compile("[0-9A-F]{12}");

    private MacAddresses() {
    }

    /**
     * Accepts {@code aa:bb:..}, {@code aa-bb-..}, {@code aabb.ccdd.eeff} and bare 12-hex forms.
     */
    public static Optional<String> normalize(String mac) {
        if (mac == null || mac.isBlank()) {
            return Optional.empty();
        }
        String clean = SEPARATORS.matcher(mac.trim().toUpperCase(Locale.ROOT)).replaceAll("");
        if (!HEX12.matcher(clean).matches() || "000000000000".equals(clean)) {
            return Optional.empty();
        }
        StringBuilder sb = new StringBuilder(17);
        for (int i = 0; i < 12; i += 2) {
            if (i > 0) sb.append(':');
            sb.append(clean, i, i + 2);
        }
        return Optional.of(sb.toString());
    }

    /**
     * Parse a value holding one or more MACs separated by newlines, whitespace,
     * commas or semicolons. Invalid entries are dropped; order is preserved.
     */
    public static Set<String> parseAll(String value) {
        Set<String> result = new LinkedHashSet<>();
        if (value == null || value.isBlank()) {
            return result;
        }
        for (String token : LIST_SPLIT.split(value.trim())) {
            normalize(token).ifPresent(result::add);
        }
        return result;
    }

    /**
     * First valid MAC of a possibly multi-valued string, taken as the primary interface.
     */
    public static Optional<String> primary(String value) {
        return parseAll(value).stream().findFirst();
    }

    /**
     * Newline separated, deduplicated canonical list.
     */
    public static String combine(Iterable<String> macs) {
        Set<String> seen = new LinkedHashSet<>();
        for (String mac : macs) {
            seen.addAll(parseAll(mac));
        }
        return seen.isEmpty() ? null : String.join("\n", seen);
    }
}
