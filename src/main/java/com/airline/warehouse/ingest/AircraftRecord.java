package com.airline.warehouse.ingest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class AircraftRecord extends SourceRecord {

    private String tailNumber;
    private String aircraftType;
    private String manufacturer;
    private String model;
    private Integer seatingCapacity;
    private Integer cargoCapacityKg;
    private Integer manufactureYear;
    private String ownershipType;
    private String maintenanceCycle;

    @Override
    public RecordKind getKind() {
        return RecordKind.AIRCRAFT;
    }

    @Override
    public String getRecordKey() {
        return tailNumber;
    }
}
