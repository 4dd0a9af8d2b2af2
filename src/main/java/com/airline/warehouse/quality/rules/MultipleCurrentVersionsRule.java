package com.airline.warehouse.quality.rules;

import com.airline.warehouse.quality.QualityRule;
import com.airline.warehouse.quality.QualitySeverity;
import com.airline.warehouse.repository.VersionedDimensionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Business keys with more than one current version, across all dimensions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MultipleCurrentVersionsRule implements QualityRule {

    private final List<VersionedDimensionRepository<?>> repositories;

    @Override
    public String getRuleName() {
        return "multiple_current_versions";
    }

    @Override
    public QualitySeverity getSeverity() {
        return QualitySeverity.CRITICAL;
    }

    @Override
    public long countViolations() {
        long violations = 0;
        for (VersionedDimensionRepository<?> repository : repositories) {
            List<String> keys = repository.findBusinessKeysWithMultipleCurrentVersions();
            if (!keys.isEmpty()) {
                log.debug("Several current versions for {}", keys);
            }
            violations += keys.size();
        }
        return violations;
    }
}
