package com.assetsync.reconciler.model.domain;

import com.assetsync.reconciler.model.enums.IdentityBasis;

/**
 * Key under which records from different sources are recognized as the same asset.
 * Rendered as {@code basis:value}, e.g. {@code serial:PF3ABC12}.
 */
public record IdentityKey(IdentityBasis basis, String value) {

    public static IdentityKey parse(String rendered) {
        int idx = rendered == null ? -1 : rendered.indexOf(':');
        if (idx <= 0 || idx == rendered.length() - 1) {
            throw new IllegalArgumentException("Malformed identity key: " + rendered);
        }
        return new IdentityKey(IdentityBasis.fromPrefix(rendered.substring(0, idx)),
                rendered.substring(idx + 1));
    }

    public boolean isLowConfidence() {
        return basis.isLowConfidence();
    }

    @Override
    public String toString() {
        return basis.getPrefix() + ":" + value;
    }
}
