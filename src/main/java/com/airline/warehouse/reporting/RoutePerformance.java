package com.airline.warehouse.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * On-time and load figures for one departure/arrival airport pair.
 */
@Value
public class RoutePerformance {

    String departureAirport;
    String arrivalAirport;
    long totalFlights;
    long onTimeFlights;
    BigDecimal onTimePercentage;
    double avgArrivalDelay;
    double avgDepartureDelay;
    double avgLoadFactor;

    public RoutePerformance(String departureAirport, String arrivalAirport, Long totalFlights,
                            Long onTimeFlights, Double avgArrivalDelay, Double avgDepartureDelay,
                            Double avgLoadFactor) {
        this.departureAirport = departureAirport;
        this.arrivalAirport = arrivalAirport;
        this.totalFlights = totalFlights == null ? 0 : totalFlights;
        this.onTimeFlights = onTimeFlights == null ? 0 : onTimeFlights;
        this.onTimePercentage = this.totalFlights == 0
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(100L * this.onTimeFlights)
                .divide(BigDecimal.valueOf(this.totalFlights), 2, RoundingMode.HALF_UP);
        this.avgArrivalDelay = avgArrivalDelay == null ? 0.0 : avgArrivalDelay;
        this.avgDepartureDelay = avgDepartureDelay == null ? 0.0 : avgDepartureDelay;
        this.avgLoadFactor = avgLoadFactor == null ? 0.0 : avgLoadFactor;
    }
}
