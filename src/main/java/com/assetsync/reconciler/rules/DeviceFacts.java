package com.assetsync.reconciler.rules;

import com.assetsync.reconciler.model.domain.RawDeviceRecord;
import com.assetsync.reconciler.util.TextNormalizer;

/**
 * Normalized, case-folded strings the classification rules look at.
 */
public record DeviceFacts(String vendor, String model, String os, String services) {

    public static DeviceFacts of(RawDeviceRecord record) {
        return new DeviceFacts(
                TextNormalizer.forMatching(record.text(RawDeviceRecord.MANUFACTURER)),
                TextNormalizer.forMatching(record.text(RawDeviceRecord.MODEL)),
                TextNormalizer.forMatching(record.text(RawDeviceRecord.OS_PLATFORM)),
                TextNormalizer.forMatching(record.text(RawDeviceRecord.SERVICES)));
    }

    public static DeviceFacts of(String vendor, String model, String os) {
        return new DeviceFacts(
                TextNormalizer.forMatching(vendor),
                TextNormalizer.forMatching(model),
                TextNormalizer.forMatching(os),
                "");
    }
}
