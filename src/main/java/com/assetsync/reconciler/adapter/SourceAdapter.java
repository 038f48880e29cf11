package com.assetsync.reconciler.adapter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.assetsync.reconciler.exception.AcquisitionException;
import com.assetsync.reconciler.model.domain.RawDeviceRecord;
import com.assetsync.reconciler.model.enums.SourceType;

/**
 * Interface for source-specific adapters.
 *
 * Each source (MDM, SNMP poller, port scanner, static table) implements this
 * interface to turn its native record shape into {@link RawDeviceRecord}s with
 * identity hints lifted out and attributes under canonical field names.
 */
public interface SourceAdapter {

    /**
     * Get the source type this adapter handles.
     */
    SourceType getSourceType();

    /**
     * Convert native records.
     *
     * @param nativeRecords records as delivered by the source
     * @param observedAt    acquisition time stamped on every record
     * @return one raw record per native record, in input order
     * @throws AcquisitionException if a native record cannot be read at all
     */
    List<RawDeviceRecord> adapt(List<Map<String, Object>> nativeRecords, Instant observedAt);
}
