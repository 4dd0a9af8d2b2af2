package com.airline.warehouse.ingest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class AirportRecord extends SourceRecord {

    private String iata;
    private String icao;
    private String airportName;
    private String city;
    private String state;
    private String country;
    private String region;
    private BigDecimal latitude;
    private BigDecimal longitude;
    private String timezone;

    @Override
    public RecordKind getKind() {
        return RecordKind.AIRPORT;
    }

    @Override
    public String getRecordKey() {
        return iata;
    }
}
