package com.assetsync.reconciler.model.dto;

import java.time.Instant;
import java.util.Map;

import com.assetsync.reconciler.model.domain.CanonicalAssetRecord;
import com.assetsync.reconciler.model.domain.FieldValue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * REST view of a canonical asset record.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssetRecordView {

    private String identityKey;
    private Long inventoryId;
    private String category;
    private String deviceType;
    private String classificationPath;
    private String name;
    private String location;
    private String placement;
    private Map<String, FieldValue> fields;
    private String lastUpdateSource;
    private Instant lastUpdateAt;

    public static AssetRecordView from(CanonicalAssetRecord record) {
        return AssetRecordView.builder()
                .identityKey(record.getIdentityKey().toString())
                .inventoryId(record.getInventoryId())
                .category(record.getCategory().getInventoryLabel())
                .deviceType(record.getCategory().getDeviceType())
                .classificationPath(record.getClassificationPath().name())
                .name(record.getName())
                .location(record.getLocation())
                .placement(record.getPlacement())
                .fields(record.getFields())
                .lastUpdateSource(record.getLastUpdateSource() != null ? record.getLastUpdateSource().name() : null)
                .lastUpdateAt(record.getLastUpdateAt())
                .build();
    }
}
