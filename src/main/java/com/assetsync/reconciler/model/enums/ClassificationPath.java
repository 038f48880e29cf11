package com.assetsync.reconciler.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How a category was decided. Higher precedence may replace lower, never the reverse.
 */
@Getter
@RequiredArgsConstructor
public enum ClassificationPath {

    FALLBACK(0),
    RULE_BASED(1),
    STATIC_OVERRIDE(2);

    private final int precedence;

    /**
     * Whether a category decided by this path may replace one decided by {@code other}.
     */
    public boolean mayReplace(ClassificationPath other) {
        return other == null || precedence >= other.precedence;
    }
}
