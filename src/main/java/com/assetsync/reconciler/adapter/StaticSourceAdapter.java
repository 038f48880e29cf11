package com.assetsync.reconciler.adapter;

import java.util.Map;

import org.springframework.stereotype.Component;

import com.assetsync.reconciler.model.domain.RawDeviceRecord;
import com.assetsync.reconciler.model.enums.SourceType;

/**
 * Adapter for static table entries, so that override-only assets reach the
 * inventory even when no scanner has seen them.
 */
@Component
public class StaticSourceAdapter extends BaseSourceAdapter {

    @Override
    public SourceType getSourceType() {
        return SourceType.STATIC;
    }

    @Override
    protected void adaptRecord(Map<String, Object> entry, RawDeviceRecord.RawDeviceRecordBuilder builder) {
        builder.ip(text(entry, "ip"));

        putAttribute(builder, RawDeviceRecord.NAME, text(entry, "name"));
        putAttribute(builder, RawDeviceRecord.SERVICES, text(entry, "services"));
    }
}
