package com.airline.warehouse.transform;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A flight record with defaults applied and derived measures computed. Dimension
 * references are still business keys.
 */
@Value
@Builder(toBuilder = true)
public class TransformedFlight implements TransformedRecord {

    String flightFactKey;
    String flightNumber;
    String carrierCode;
    LocalDate flightDate;
    String tailNumber;
    String departureAirport;
    String arrivalAirport;
    int departureDelayMin;
    int arrivalDelayMin;
    int seatsAvailable;
    int seatsFilled;
    BigDecimal loadFactor;
    boolean onTime;
    BigDecimal revenue;
    BigDecimal fuelCost;
    Integer distanceMiles;
    boolean cancelled;

    @Override
    public String getKey() {
        return flightFactKey;
    }
}
