package com.airline.warehouse.quality.rules;

import com.airline.warehouse.quality.QualityRule;
import com.airline.warehouse.repository.FlightFactRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Load factors outside 0 to 100 percent.
 */
@Component
@RequiredArgsConstructor
public class InvalidLoadFactorRule implements QualityRule {

    private final FlightFactRepository factRepository;

    @Override
    public String getRuleName() {
        return "invalid_load_factors";
    }

    @Override
    public long countViolations() {
        return factRepository.countLoadFactorOutOfRange();
    }
}
