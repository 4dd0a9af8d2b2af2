package com.airline.warehouse.exception;

import com.airline.warehouse.entity.DimensionType;
import lombok.Getter;

/**
 * A merge still conflicted after the configured number of attempts. Fails that entity only.
 */
@Getter
public class MergeConflictException extends WarehouseLoadException {

    private final DimensionType dimensionType;
    private final String businessKey;

    public MergeConflictException(DimensionType dimensionType, String businessKey, int attempts, Throwable cause) {
        super(String.format("Gave up merging %s '%s' after %d attempts", dimensionType.configName(), businessKey, attempts),
            cause);
        this.dimensionType = dimensionType;
        this.businessKey = businessKey;
    }
}
