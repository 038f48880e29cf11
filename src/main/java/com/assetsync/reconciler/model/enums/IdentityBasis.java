package com.assetsync.reconciler.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Identifier an identity key was derived from, in precedence order.
 */
@Getter
@RequiredArgsConstructor
public enum IdentityBasis {

    STATIC_OVERRIDE("static", false),
    DEVICE_ID("device", false),
    SERIAL("serial", false),
    MAC("mac", false),
    IP("ip", false),

    /**
     * Normalized hostname plus source. May merge distinct devices that share a name.
     */
    HOSTNAME("hostname", true);

    /**
     * Prefix used when rendering the key
     */
    private final String prefix;

    private final boolean lowConfidence;

    public static IdentityBasis fromPrefix(String prefix) {
        for (IdentityBasis basis : values()) {
            if (basis.prefix.equals(prefix)) {
                return basis;
            }
        }
        throw new IllegalArgumentException("Unknown identity prefix: " + prefix);
    }
}
