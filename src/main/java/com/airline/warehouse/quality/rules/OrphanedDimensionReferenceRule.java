package com.airline.warehouse.quality.rules;

import com.airline.warehouse.quality.QualityRule;
import com.airline.warehouse.quality.QualitySeverity;
import com.airline.warehouse.repository.FlightFactRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Facts whose aircraft or airport key matches no dimension row.
 */
@Component
@RequiredArgsConstructor
public class OrphanedDimensionReferenceRule implements QualityRule {

    private final FlightFactRepository factRepository;

    @Override
    public String getRuleName() {
        return "orphaned_dimension_references";
    }

    @Override
    public QualitySeverity getSeverity() {
        return QualitySeverity.CRITICAL;
    }

    @Override
    public long countViolations() {
        return factRepository.countOrphanedDimensionReferences();
    }
}
