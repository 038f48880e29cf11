package com.assetsync.reconciler.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.springframework.stereotype.Service;

import com.assetsync.reconciler.model.domain.IdentityKey;
import com.assetsync.reconciler.model.domain.RawDeviceRecord;
import com.assetsync.reconciler.model.domain.ResolvedIdentity;
import com.assetsync.reconciler.model.domain.StaticOverride;
import com.assetsync.reconciler.model.enums.IdentityBasis;
import com.assetsync.reconciler.rules.StaticOverrideTable;
import com.assetsync.reconciler.util.MacAddresses;
import com.assetsync.reconciler.util.TextNormalizer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Computes the canonical identity key of a raw record.
 *
 * Precedence (first non-empty wins):
 * <ol>
 *   <li>static override table hit on the IP</li>
 *   <li>management-system device id</li>
 *   <li>hardware serial</li>
 *   <li>primary MAC address</li>
 *   <li>last-seen IP</li>
 *   <li>hostname + source (low confidence)</li>
 * </ol>
 * Never fails. Low-confidence keys may merge distinct devices that share a
 * hostname; each one is logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentityResolver {

    private static final Set<String> PLACEHOLDER_SERIALS = Set.of(
            "UNKNOWN", "0", "NONE", "N/A", "DEFAULT STRING", "TO BE FILLED BY O.E.M.");

    private final StaticOverrideTable staticOverrides;

    public ResolvedIdentity resolve(RawDeviceRecord record) {
        Optional<StaticOverride> override = staticOverrides.find(record.getIp());
        if (override.isPresent()) {
            return new ResolvedIdentity(
                    new IdentityKey(IdentityBasis.STATIC_OVERRIDE, record.getIp().trim()), override.get());
        }

        if (!TextNormalizer.isBlank(record.getDeviceId())) {
            return identity(IdentityBasis.DEVICE_ID, record.getDeviceId().trim().toLowerCase(Locale.ROOT));
        }

        String serial = normalizeSerial(record.getSerial());
        if (serial != null) {
            return identity(IdentityBasis.SERIAL, serial);
        }

        Optional<String> mac = MacAddresses.primary(record.getMac());
        if (mac.isPresent()) {
            return identity(IdentityBasis.MAC, mac.get());
        }

        if (!TextNormalizer.isBlank(record.getIp())) {
            return identity(IdentityBasis.IP, record.getIp().trim());
        }

        IdentityKey fallback = hostnameKey(record);
        log.warn("Low-confidence identity {} for {} record (no device id, serial, MAC or IP)",
                fallback, record.getSource());
        return new ResolvedIdentity(fallback, null);
    }

    /**
     * Short, lower-cased hostname, or null for placeholders that identify nothing.
     */
    static String shortHostname(String hostname) {
        String normalized = TextNormalizer.forMatching(hostname);
        if (normalized.isEmpty()) {
            return null;
        }
        int dot = normalized.indexOf('.');
        String shortName = (dot > 0 ? normalized.substring(0, dot) : normalized).replace(' ', '-');
        if (isPlaceholderName(shortName)) {
            return null;
        }
        return shortName;
    }

    /**
     * Generated or generic names ("Device-10.0.0.5", "unknown", "_gateway").
     */
    public static boolean isPlaceholderName(String name) {
        if (name == null) {
            return true;
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        return lower.length() < 3
                || lower.startsWith("device-")
                || lower.startsWith("unknown")
                || lower.equals("_gateway");
    }

    private IdentityKey hostnameKey(RawDeviceRecord record) {
        String source = record.getSource().name().toLowerCase(Locale.ROOT);
        String shortName = shortHostname(record.getHostname());
        if (shortName == null) {
            shortName = shortHostname(record.text(RawDeviceRecord.NAME));
        }
        if (shortName == null) {
            shortName = "anon-" + attributeHash(record.getAttributes());
        }
        return new IdentityKey(IdentityBasis.HOSTNAME, source + ":" + shortName);
    }

    private static String normalizeSerial(String serial) {
        if (TextNormalizer.isBlank(serial)) {
            return null;
        }
        String upper = serial.trim().toUpperCase(Locale.ROOT);
        return PLACEHOLDER_SERIALS.contains(upper) ? null : upper;
    }

    private static String attributeHash(Map<String, Object> attributes) {
        TreeMap<String, String> sorted = new TreeMap<>();
        attributes.forEach((key, value) -> sorted.put(key, String.valueOf(value)));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(sorted.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static ResolvedIdentity identity(IdentityBasis basis, String value) {
        return new ResolvedIdentity(new IdentityKey(basis, value), null);
    }
}
