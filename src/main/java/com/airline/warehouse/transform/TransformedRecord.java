package com.airline.warehouse.transform;

/**
 * A validated record ready to be written to the warehouse.
 */
public interface TransformedRecord {

    /**
     * Key that serializes writes: the business key of a dimension snapshot or the
     * fact key of a flight.
     */
    String getKey();
}
