package com.airline.warehouse.exception;

/**
 * Base type of the loader's own failures.
 */
public class WarehouseLoadException extends RuntimeException {

    public WarehouseLoadException(String message) {
        super(message);
    }

    public WarehouseLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
