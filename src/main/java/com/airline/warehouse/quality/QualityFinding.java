package com.airline.warehouse.quality;

import lombok.Builder;
import lombok.Value;

/**
 * Result of running one quality rule.
 */
@Value
@Builder
public class QualityFinding {

    String ruleName;
    long violationCount;
    QualitySeverity severity;
    boolean passed;

    /** Why the rule could not run; null when it did. */
    String error;

    public static QualityFinding of(QualityRule rule, long violations) {
        return QualityFinding.builder()
            .ruleName(rule.getRuleName())
            .violationCount(violations)
            .severity(violations == 0 ? QualitySeverity.INFO : rule.getSeverity())
            .passed(violations == 0)
            .build();
    }

    public static QualityFinding failedToRun(QualityRule rule, Throwable error) {
        return QualityFinding.builder()
            .ruleName(rule.getRuleName())
            .violationCount(0)
            .severity(QualitySeverity.ERROR)
            .passed(false)
            .error(error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage())
            .build();
    }
}
