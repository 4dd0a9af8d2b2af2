package com.airline.warehouse.exception;

/**
 * A revision of an existing fact does not fit the stored row, e.g. it fills more seats
 * than the flight was loaded with.
 */
public class FactRevisionRejectedException extends WarehouseLoadException {

    public FactRevisionRejectedException(String factKey, String reason) {
        super(String.format("Revision of fact '%s' rejected: %s", factKey, reason));
    }
}
