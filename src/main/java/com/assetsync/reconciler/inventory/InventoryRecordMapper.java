package com.assetsync.reconciler.inventory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.assetsync.reconciler.model.domain.CanonicalAssetRecord;
import com.assetsync.reconciler.model.domain.FieldValue;
import com.assetsync.reconciler.model.domain.IdentityKey;
import com.assetsync.reconciler.model.enums.AssetCategory;
import com.assetsync.reconciler.model.enums.ClassificationPath;
import com.assetsync.reconciler.model.enums.SourceType;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps canonical records to and from the store's flat JSON payload.
 *
 * <pre>
 * {
 *   "id": 12,
 *   "identity_key": "serial:PF3ABC12",
 *   "name": "LAPTOP-01",
 *   "category": "Laptops",
 *   "classification_path": "RULE_BASED",
 *   "location": null,
 *   "placement": null,
 *   "fields": { "os_platform": { "value": "Windows", "source": "MDM", "updated_at": "..." } },
 *   "last_update_source": "MDM",
 *   "last_update_at": "2026-01-05T10:00:00Z"
 * }
 * </pre>
 */
@Slf4j
public final class InventoryRecordMapper {

    private InventoryRecordMapper() {
    }

    public static Map<String, Object> toPayload(CanonicalAssetRecord record) {
        Map<String, Object> fields = new LinkedHashMap<>();
        record.getFields().forEach((name, value) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("value", value.value());
            entry.put("source", value.source() != null ? value.source().name() : null);
            entry.put("updated_at", value.updatedAt() != null ? value.updatedAt().toString() : null);
            fields.put(name, entry);
        });

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("identity_key", record.getIdentityKey().toString());
        payload.put("name", record.getName());
        payload.put("category", record.getCategory().getInventoryLabel());
        payload.put("classification_path", record.getClassificationPath().name());
        payload.put("location", record.getLocation());
        payload.put("placement", record.getPlacement());
        payload.put("fields", fields);
        payload.put("last_update_source",
                record.getLastUpdateSource() != null ? record.getLastUpdateSource().name() : null);
        payload.put("last_update_at",
                record.getLastUpdateAt() != null ? record.getLastUpdateAt().toString() : null);
        return payload;
    }

    /**
     * Read a stored row. Unknown enum names and unparseable timestamps fall back to
     * {@code FALLBACK} or null; only a missing or malformed identity key is rejected.
     *
     * @throws IllegalArgumentException if the row has no usable identity key
     */
    public static CanonicalAssetRecord fromPayload(Map<String, Object> payload) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        if (payload.get("fields") instanceof Map<?, ?> rawFields) {
            rawFields.forEach((name, raw) -> {
                if (raw instanceof Map<?, ?> entry && entry.get("value") != null) {
                    fields.put(String.valueOf(name), new FieldValue(
                            String.valueOf(entry.get("value")),
                            source(entry.get("source")),
                            instant(entry.get("updated_at"))));
                } else if (raw != null && !(raw instanceof Map<?, ?>)) {
                    fields.put(String.valueOf(name), new FieldValue(String.valueOf(raw), null, null));
                }
            });
        }

        return CanonicalAssetRecord.builder()
                .inventoryId(payload.get("id") instanceof Number id ? id.longValue() : null)
                .identityKey(IdentityKey.parse(text(payload.get("identity_key"))))
                .name(text(payload.get("name")))
                .category(AssetCategory.fromLabel(text(payload.get("category"))).orElse(AssetCategory.OTHER))
                .classificationPath(path(payload.get("classification_path")))
                .location(text(payload.get("location")))
                .placement(text(payload.get("placement")))
                .fields(fields)
                .lastUpdateSource(source(payload.get("last_update_source")))
                .lastUpdateAt(instant(payload.get("last_update_at")))
                .build();
    }

    private static String text(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    private static ClassificationPath path(Object value) {
        if (value == null) {
            return ClassificationPath.FALLBACK;
        }
        try {
            return ClassificationPath.valueOf(String.valueOf(value).trim());
        } catch (IllegalArgumentException e) {
            log.debug("Unknown classification path '{}', treating as FALLBACK", value);
            return ClassificationPath.FALLBACK;
        }
    }

    private static SourceType source(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return SourceType.valueOf(String.valueOf(value).trim());
        } catch (IllegalArgumentException e) {
            log.debug("Unknown source '{}' on stored row", value);
            return null;
        }
    }

    private static Instant instant(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(String.valueOf(value));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp '{}' on stored row", value);
            return null;
        }
    }
}
