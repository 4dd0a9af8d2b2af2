package com.airline.warehouse.exception;

import com.airline.warehouse.entity.DimensionType;

/**
 * A fact refers to a business key the dimension has never seen.
 */
public class UnresolvedReferenceException extends WarehouseLoadException {

    public UnresolvedReferenceException(String factKey, DimensionType type, String businessKey) {
        super(String.format("Fact '%s' references unknown %s '%s'", factKey, type.configName(), businessKey));
    }
}
