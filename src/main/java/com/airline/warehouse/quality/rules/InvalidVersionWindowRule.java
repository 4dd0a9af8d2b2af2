package com.airline.warehouse.quality.rules;

import com.airline.warehouse.entity.VersionedDimension;
import com.airline.warehouse.quality.QualityRule;
import com.airline.warehouse.repository.VersionedDimensionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Expired versions that end before they start, and current versions that do not run to
 * the open end.
 */
@Component
@RequiredArgsConstructor
public class InvalidVersionWindowRule implements QualityRule {

    private final List<VersionedDimensionRepository<?>> repositories;

    @Override
    public String getRuleName() {
        return "invalid_version_windows";
    }

    @Override
    public long countViolations() {
        return repositories.stream()
            .mapToLong(repository -> repository.countInvalidVersionWindows(VersionedDimension.OPEN_END))
            .sum();
    }
}
