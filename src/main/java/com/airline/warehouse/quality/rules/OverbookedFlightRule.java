package com.airline.warehouse.quality.rules;

import com.airline.warehouse.quality.QualityRule;
import com.airline.warehouse.repository.FlightFactRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class OverbookedFlightRule implements QualityRule {

    private final FlightFactRepository factRepository;

    @Override
    public String getRuleName() {
        return "overbooked_flights";
    }

    @Override
    public long countViolations() {
        return factRepository.countOverbooked();
    }
}
