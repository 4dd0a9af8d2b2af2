package com.airline.warehouse.validation;

/**
 * Why a record was rejected.
 */
public enum FailureReason {
    MALFORMED_RECORD,
    MISSING_REQUIRED_FIELD,
    NON_POSITIVE_CAPACITY,
    NEGATIVE_VALUE,
    SEATS_EXCEED_CAPACITY,
    SAME_ORIGIN_AND_DESTINATION,
    INVALID_CODE,
    INVALID_FORMAT,
    OUT_OF_RANGE
}
