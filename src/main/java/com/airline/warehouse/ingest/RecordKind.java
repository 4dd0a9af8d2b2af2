package com.airline.warehouse.ingest;

import com.airline.warehouse.entity.DimensionType;

/**
 * Kinds of ingest records. Dimension kinds map to the dimension they feed.
 */
public enum RecordKind {

    CUSTOMER(DimensionType.CUSTOMER),
    AIRCRAFT(DimensionType.AIRCRAFT),
    AIRPORT(DimensionType.AIRPORT),
    FLIGHT(null),
    MALFORMED(null);

    private final DimensionType dimensionType;

    RecordKind(DimensionType dimensionType) {
        this.dimensionType = dimensionType;
    }

    public DimensionType dimensionType() {
        return dimensionType;
    }

    public boolean isDimension() {
        return dimensionType != null;
    }
}
