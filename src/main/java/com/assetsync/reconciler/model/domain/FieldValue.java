package com.assetsync.reconciler.model.domain;

import java.time.Instant;

import com.assetsync.reconciler.model.enums.SourceType;

/**
 * A canonical field value with its provenance.
 */
public record FieldValue(String value, SourceType source, Instant updatedAt) {
}
