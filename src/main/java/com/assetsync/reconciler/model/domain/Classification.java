package com.assetsync.reconciler.model.domain;

import com.assetsync.reconciler.model.enums.AssetCategory;
import com.assetsync.reconciler.model.enums.ClassificationPath;

/**
 * Category decided for a record, with the path and rule that decided it.
 */
public record Classification(AssetCategory category, ClassificationPath path, String ruleName) {

    public static Classification staticOverride(AssetCategory category) {
        return new Classification(category, ClassificationPath.STATIC_OVERRIDE, "static-override");
    }

    public static Classification rule(AssetCategory category, String ruleName) {
        return new Classification(category, ClassificationPath.RULE_BASED, ruleName);
    }

    public static Classification fallback() {
        return new Classification(AssetCategory.OTHER, ClassificationPath.FALLBACK, "fallback");
    }
}
