package com.assetsync.reconciler.model.domain;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.assetsync.reconciler.model.enums.AssetCategory;
import com.assetsync.reconciler.model.enums.ClassificationPath;
import com.assetsync.reconciler.model.enums.SourceType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canonical Asset Record - the merged, deduplicated view of one device.
 *
 * Exactly one record exists per identity key. Category is never null
 * ({@link AssetCategory#OTHER} when nothing matched) and a field entry is
 * never overwritten with an empty value.
 *
 * Location and placement are only ever set from the static override table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CanonicalAssetRecord {

    private IdentityKey identityKey;

    /**
     * Id assigned by the inventory store, null until created.
     */
    private Long inventoryId;

    @Builder.Default
    private AssetCategory category = AssetCategory.OTHER;

    @Builder.Default
    private ClassificationPath classificationPath = ClassificationPath.FALLBACK;

    private String name;

    @Builder.Default
    private Map<String, FieldValue> fields = new LinkedHashMap<>();

    private String location;

    private String placement;

    private SourceType lastUpdateSource;

    private Instant lastUpdateAt;

    public String fieldValue(String fieldName) {
        FieldValue value = fields.get(fieldName);
        return value != null ? value.value() : null;
    }

    /**
     * Deep enough copy to mutate during a merge without touching the original.
     */
    public CanonicalAssetRecord copy() {
        return toBuilder().fields(new LinkedHashMap<>(fields)).build();
    }

    /**
     * Plain field values without provenance.
     */
    public Map<String, String> fieldValues() {
        Map<String, String> values = new LinkedHashMap<>();
        fields.forEach((key, value) -> values.put(key, value.value()));
        return values;
    }

    /**
     * Compare everything the store persists, ignoring provenance and update metadata.
     */
    public boolean contentEquals(CanonicalAssetRecord other) {
        if (other == null) {
            return false;
        }
        return category == other.category
                && classificationPath == other.classificationPath
                && Objects.equals(name, other.name)
                && Objects.equals(location, other.location)
                && Objects.equals(placement, other.placement)
                && fieldValues().equals(other.fieldValues());
    }
}
