package com.assetsync.reconciler.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cleans free-text identification strings (vendor, model, hostname) into a
 * comparable form. Pure and idempotent: {@code normalize(normalize(x)) == normalize(x)}.
 */
public final class TextNormalizer {

    private static final Pattern STRIPPED = Pattern.compile("[()\"'/\\\\“”‘’]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /**
     * Display form: case preserved, {@code "} becomes {@code -inch}, quotes,
     * parentheses and slashes removed, whitespace collapsed.
     *
     * <pre>
     * normalize("iPad Pro (11\")(2nd generation)") = "iPad Pro 11-inch 2nd generation"
     * </pre>
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.replace("\"", "-inch");
        text = STRIPPED.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Matching form: {@link #normalize(String)} then case-folded.
     */
    public static String forMatching(String raw) {
        return normalize(raw).toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
