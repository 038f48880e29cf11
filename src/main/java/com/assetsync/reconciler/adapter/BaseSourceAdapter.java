package com.assetsync.reconciler.adapter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.assetsync.reconciler.exception.AcquisitionException;
import com.assetsync.reconciler.model.domain.RawDeviceRecord;

import lombok.extern.slf4j.Slf4j;

/**
 * Shared loop and value helpers for source adapters.
 */
@Slf4j
public abstract class BaseSourceAdapter implements SourceAdapter {

    @Override
    public List<RawDeviceRecord> adapt(List<Map<String, Object>> nativeRecords, Instant observedAt) {
        List<RawDeviceRecord> records = new ArrayList<>(nativeRecords.size());
        int index = 0;
        for (Map<String, Object> nativeRecord : nativeRecords) {
            if (nativeRecord == null) {
                throw new AcquisitionException(getSourceType() + " record #" + index + " is null");
            }
            try {
                RawDeviceRecord.RawDeviceRecordBuilder builder = RawDeviceRecord.builder()
                        .source(getSourceType())
                        .observedAt(observedAt);
                adaptRecord(nativeRecord, builder);
                records.add(builder.build());
            } catch (AcquisitionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new AcquisitionException(
                        "Malformed " + getSourceType() + " record #" + index + ": " + e.getMessage(), e);
            }
            index++;
        }
        log.debug("{} adapter produced {} records", getSourceType(), records.size());
        return records;
    }

    /**
     * Fill the builder from one native record. Source and observation time are already set.
     */
    protected abstract void adaptRecord(Map<String, Object> nativeRecord, RawDeviceRecord.RawDeviceRecordBuilder builder);

    /**
     * Copy a value under its canonical name when present and non-blank.
     */
    protected static void putAttribute(RawDeviceRecord.RawDeviceRecordBuilder builder, String name, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof String text && text.isBlank()) {
            return;
        }
        if (value instanceof Collection<?> items && items.isEmpty()) {
            return;
        }
        builder.attribute(name, value instanceof String s ? s.trim() : value);
    }

    protected static String text(Map<String, Object> nativeRecord, String key) {
        Object value = nativeRecord.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }
}
