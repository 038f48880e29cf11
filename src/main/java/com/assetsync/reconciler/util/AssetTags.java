package com.assetsync.reconciler.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Generated asset tags of the form {@code AUTO-yyyyMMddHHmmss-XXXXXX}.
 */
public final class AssetTags {

    public static final String PREFIX = "AUTO-";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private AssetTags() {
    }

    public static String generate(String identityKey, Instant at) {
        return PREFIX + TIMESTAMP.format(at) + "-" + hashPart(identityKey);
    }

    public static boolean isGenerated(String assetTag) {
        return assetTag != null && assetTag.matches("AUTO-\\d{14}-[0-9A-F]{6}");
    }

    private static String hashPart(String identityKey) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(identityKey.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 3).toUpperCase(Locale.ROOT);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
