package com.airline.warehouse.exception;

/**
 * The key sequence of a dimension ran past its maximum. Fatal for the batch.
 */
public class SurrogateKeyExhaustedException extends WarehouseLoadException {

    public SurrogateKeyExhaustedException(String sequenceName, long maxValue) {
        super(String.format("Surrogate key sequence '%s' exhausted at %d", sequenceName, maxValue));
    }
}
