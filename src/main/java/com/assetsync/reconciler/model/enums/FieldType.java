package com.assetsync.reconciler.model.enums;

/**
 * Storage shape of an inventory custom field.
 */
public enum FieldType {
    TEXT,
    NUMBER,
    BOOLEAN,
    TEXTAREA
}
