package com.airline.warehouse.ingest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One line of an ingest file. The {@code type} property selects the schema; all fields
 * are nullable so that incomplete records still parse and reach validation.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = CustomerRecord.class, name = "customer"),
    @JsonSubTypes.Type(value = AircraftRecord.class, name = "aircraft"),
    @JsonSubTypes.Type(value = AirportRecord.class, name = "airport"),
    @JsonSubTypes.Type(value = FlightRecord.class, name = "flight")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class SourceRecord {

    @JsonIgnore
    public abstract RecordKind getKind();

    /**
     * Business key or fact key; may be null on an invalid record.
     */
    @JsonIgnore
    public abstract String getRecordKey();
}
