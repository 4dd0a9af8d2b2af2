package com.airline.warehouse.ingest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A flight leg as reported by operations. Dimension references are business keys
 * (tail number, IATA codes); the loader resolves them to surrogate keys.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class FlightRecord extends SourceRecord {

    private String flightFactKey;
    private String flightNumber;
    private String carrierCode;
    private LocalDate flightDate;
    private String tailNumber;
    private String departureAirport;
    private String arrivalAirport;
    private Integer departureDelayMin;
    private Integer arrivalDelayMin;
    private Integer seatsAvailable;
    private Integer seatsFilled;
    private BigDecimal revenue;
    private BigDecimal fuelCost;
    private Integer distanceMiles;
    private Boolean cancelled;

    @Override
    public RecordKind getKind() {
        return RecordKind.FLIGHT;
    }

    @Override
    public String getRecordKey() {
        return flightFactKey;
    }
}
