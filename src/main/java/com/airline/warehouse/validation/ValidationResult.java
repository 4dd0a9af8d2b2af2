package com.airline.warehouse.validation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of validating one record: valid, or the list of checks it failed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    List<ValidationFailure> failures;

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(List<ValidationFailure> failures) {
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one failure");
        }
        return new ValidationResult(List.copyOf(failures));
    }

    public boolean isValid() {
        return failures.isEmpty();
    }

    /**
     * The first failed check, used to bucket rejections in the load summary.
     */
    public FailureReason primaryReason() {
        return isValid() ? null : failures.get(0).getReason();
    }

    public String reason() {
        return failures.stream().map(ValidationFailure::toString).collect(Collectors.joining("; "));
    }
}
