package com.airline.warehouse.dimension;

import com.airline.warehouse.entity.DimensionType;

/**
 * Single source of surrogate keys for dimension rows.
 *
 * <p>Keys are unique and strictly increasing per dimension, also across threads and
 * processes, and never reused, even when the transaction that asked for one rolls back.
 */
public interface SurrogateKeyAllocator {

    /**
     * @throws com.airline.warehouse.exception.SurrogateKeyExhaustedException when the
     *         sequence has passed its maximum
     */
    long next(DimensionType type);
}
