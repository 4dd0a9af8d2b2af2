package com.airline.warehouse.quality.rules;

import com.airline.warehouse.quality.QualityRule;
import com.airline.warehouse.repository.FlightFactRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Flights dated after today, by the injected clock.
 */
@Component
@RequiredArgsConstructor
public class FutureDatedFlightRule implements QualityRule {

    private final FlightFactRepository factRepository;
    private final Clock clock;

    @Override
    public String getRuleName() {
        return "future_dated_flights";
    }

    @Override
    public long countViolations() {
        return factRepository.countFlightsDatedAfter(LocalDate.now(clock));
    }
}
