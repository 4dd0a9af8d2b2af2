package com.airline.warehouse.exception;

import com.airline.warehouse.entity.DimensionType;

import java.time.LocalDateTime;

/**
 * A snapshot is older than the version that is already current for its business key.
 */
public class OutOfOrderChangeException extends WarehouseLoadException {

    public OutOfOrderChangeException(DimensionType type, String businessKey, LocalDateTime asOf,
                                     LocalDateTime currentEffective) {
        super(String.format("%s '%s' as of %s predates the current version effective %s",
            type.configName(), businessKey, asOf, currentEffective));
    }
}
