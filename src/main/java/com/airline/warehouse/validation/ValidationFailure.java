package com.airline.warehouse.validation;

import lombok.Value;

@Value
public class ValidationFailure {

    FailureReason reason;
    String field;
    String detail;

    @Override
    public String toString() {
        return reason + "(" + field + "): " + detail;
    }
}
