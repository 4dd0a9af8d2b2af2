package com.airline.warehouse.entity;

import java.util.Locale;

/**
 * The SCD2 dimensions maintained by the loader.
 */
public enum DimensionType {

    CUSTOMER("dim_customer_key"),
    AIRCRAFT("dim_aircraft_key"),
    AIRPORT("dim_airport_key");

    private final String sequenceName;

    DimensionType(String sequenceName) {
        this.sequenceName = sequenceName;
    }

    public String sequenceName() {
        return sequenceName;
    }

    /**
     * Name used in configuration keys, e.g. {@code customer}.
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
