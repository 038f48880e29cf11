package com.assetsync.reconciler.rules;

import com.assetsync.reconciler.model.enums.AssetCategory;

/**
 * One row of the classification table.
 *
 * @param group    rule group the row belongs to (network, mobile-os, ...)
 * @param name     row name reported with the classification
 * @param category category returned when the condition holds
 */
public record ClassificationRule(String group, String name, AssetCategory category, Condition condition) {

    public boolean matches(DeviceFacts facts) {
        return condition.test(facts);
    }
}
