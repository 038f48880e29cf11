package com.assetsync.reconciler.adapter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.assetsync.reconciler.exception.AcquisitionException;
import com.assetsync.reconciler.model.enums.SourceType;

/**
 * Something that can be asked for a source's records, e.g. an MDM API client
 * or a scanner's result store.
 */
public interface SourceCollaborator {

    SourceType getSourceType();

    /**
     * Records changed since the given instant.
     *
     * @param since start of the last successful run, or null for everything
     * @throws AcquisitionException when the source cannot be read
     */
    List<Map<String, Object>> fetchSince(Instant since);
}
