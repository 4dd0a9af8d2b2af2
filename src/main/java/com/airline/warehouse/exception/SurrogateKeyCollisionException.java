package com.airline.warehouse.exception;

import com.airline.warehouse.entity.DimensionType;

/**
 * A freshly allocated surrogate key is already taken. Fatal for the batch: the sequence
 * and the table disagree and every further allocation is suspect.
 */
public class SurrogateKeyCollisionException extends WarehouseLoadException {

    public SurrogateKeyCollisionException(DimensionType type, long surrogateKey) {
        super(String.format("Surrogate key %d allocated for %s already exists", surrogateKey, type.configName()));
    }
}
