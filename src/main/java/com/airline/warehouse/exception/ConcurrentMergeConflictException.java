package com.airline.warehouse.exception;

import com.airline.warehouse.entity.DimensionType;

/**
 * Another writer changed the current version of the same business key between our read
 * and our conditional write. Retryable: the merge is re-run from a fresh read.
 */
public class ConcurrentMergeConflictException extends WarehouseLoadException {

    public ConcurrentMergeConflictException(DimensionType type, String businessKey, String detail) {
        super(String.format("Concurrent merge on %s '%s': %s", type.configName(), businessKey, detail));
    }
}
