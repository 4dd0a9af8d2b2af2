package com.airline.warehouse.quality;

/**
 * How serious a failing quality finding is.
 */
public enum QualitySeverity {

    INFO,
    WARNING,
    CRITICAL,

    /** The check itself could not run. */
    ERROR
}
