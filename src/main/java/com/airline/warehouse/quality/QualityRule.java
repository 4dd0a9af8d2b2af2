package com.airline.warehouse.quality;

/**
 * One read-only integrity check of the warehouse.
 *
 * <p>Every Spring bean implementing this interface is run by {@link QualityAuditor}, so a
 * new check is added by declaring a new component. A rule passes when it counts no
 * violations.
 */
public interface QualityRule {

    /**
     * Unique name of this rule, e.g. {@code orphaned_dimension_references}.
     */
    String getRuleName();

    /**
     * Severity reported when the rule finds violations.
     * Defaults to {@link QualitySeverity#WARNING}.
     */
    default QualitySeverity getSeverity() {
        return QualitySeverity.WARNING;
    }

    /**
     * Counts the rows that violate this rule. Must not modify the warehouse.
     */
    long countViolations();
}
