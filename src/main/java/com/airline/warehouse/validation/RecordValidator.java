package com.airline.warehouse.validation;

import com.airline.warehouse.ingest.AircraftRecord;
import com.airline.warehouse.ingest.AirportRecord;
import com.airline.warehouse.ingest.CustomerRecord;
import com.airline.warehouse.ingest.FlightRecord;
import com.airline.warehouse.ingest.MalformedRecord;
import com.airline.warehouse.ingest.SourceRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Required-field and consistency checks on ingest records.
 *
 * <p>Pure: no state, no I/O, and it never throws. A bad record is an expected input and
 * comes back as an invalid {@link ValidationResult}.
 */
@Component
public class RecordValidator {

    private static final Pattern IATA_PATTERN = Pattern.compile("^[A-Za-z]{3}$");
    private static final Pattern ICAO_PATTERN = Pattern.compile("^[A-Za-z]{4}$");

    private static final BigDecimal MAX_LATITUDE = BigDecimal.valueOf(90);
    private static final BigDecimal MAX_LONGITUDE = BigDecimal.valueOf(180);

    public ValidationResult validate(SourceRecord record) {
        if (record == null) {
            return ValidationResult.invalid(List.of(
                new ValidationFailure(FailureReason.MALFORMED_RECORD, "record", "record is null")));
        }
        List<ValidationFailure> failures = new ArrayList<>();
        if (record instanceof FlightRecord) {
            checkFlight((FlightRecord) record, failures);
        } else if (record instanceof CustomerRecord) {
            checkCustomer((CustomerRecord) record, failures);
        } else if (record instanceof AircraftRecord) {
            checkAircraft((AircraftRecord) record, failures);
        } else if (record instanceof AirportRecord) {
            checkAirport((AirportRecord) record, failures);
        } else if (record instanceof MalformedRecord) {
            MalformedRecord malformed = (MalformedRecord) record;
            failures.add(new ValidationFailure(FailureReason.MALFORMED_RECORD,
                "line " + malformed.getLineNumber(), malformed.getError()));
        } else {
            failures.add(new ValidationFailure(FailureReason.MALFORMED_RECORD, "type",
                "unsupported record type " + record.getClass().getSimpleName()));
        }
        return failures.isEmpty() ? ValidationResult.valid() : ValidationResult.invalid(failures);
    }

    private void checkFlight(FlightRecord flight, List<ValidationFailure> failures) {
        required(failures, "flightFactKey", flight.getFlightFactKey());
        required(failures, "flightNumber", flight.getFlightNumber());
        required(failures, "flightDate", flight.getFlightDate());
        required(failures, "tailNumber", flight.getTailNumber());
        required(failures, "departureAirport", flight.getDepartureAirport());
        required(failures, "arrivalAirport", flight.getArrivalAirport());
        required(failures, "seatsAvailable", flight.getSeatsAvailable());
        required(failures, "seatsFilled", flight.getSeatsFilled());

        Integer available = flight.getSeatsAvailable();
        Integer filled = flight.getSeatsFilled();
        if (available != null && available <= 0) {
            failures.add(new ValidationFailure(FailureReason.NON_POSITIVE_CAPACITY, "seatsAvailable",
                "must be greater than zero but was " + available));
        }
        if (filled != null && filled < 0) {
            failures.add(new ValidationFailure(FailureReason.NEGATIVE_VALUE, "seatsFilled",
                "must not be negative but was " + filled));
        }
        if (available != null && filled != null && filled > available) {
            failures.add(new ValidationFailure(FailureReason.SEATS_EXCEED_CAPACITY, "seatsFilled",
                filled + " filled exceeds " + available + " available"));
        }

        String departure = flight.getDepartureAirport();
        String arrival = flight.getArrivalAirport();
        if (isPresent(departure) && isPresent(arrival)) {
            checkIata(failures, "departureAirport", departure);
            checkIata(failures, "arrivalAirport", arrival);
            if (departure.trim().equalsIgnoreCase(arrival.trim())) {
                failures.add(new ValidationFailure(FailureReason.SAME_ORIGIN_AND_DESTINATION, "arrivalAirport",
                    "departure and arrival are both " + departure));
            }
        }

        nonNegative(failures, "distanceMiles", flight.getDistanceMiles());
        nonNegative(failures, "revenue", flight.getRevenue());
        nonNegative(failures, "fuelCost", flight.getFuelCost());
    }

    private void checkCustomer(CustomerRecord customer, List<ValidationFailure> failures) {
        required(failures, "customerId", customer.getCustomerId());
        nonNegative(failures, "loyaltyPoints", customer.getLoyaltyPoints());
        String email = customer.getEmail();
        if (email != null && !email.contains("@")) {
            failures.add(new ValidationFailure(FailureReason.INVALID_FORMAT, "email", "not an email address: " + email));
        }
    }

    private void checkAircraft(AircraftRecord aircraft, List<ValidationFailure> failures) {
        required(failures, "tailNumber", aircraft.getTailNumber());
        Integer capacity = aircraft.getSeatingCapacity();
        if (capacity != null && capacity <= 0) {
            failures.add(new ValidationFailure(FailureReason.NON_POSITIVE_CAPACITY, "seatingCapacity",
                "must be greater than zero but was " + capacity));
        }
        nonNegative(failures, "cargoCapacityKg", aircraft.getCargoCapacityKg());
    }

    private void checkAirport(AirportRecord airport, List<ValidationFailure> failures) {
        required(failures, "iata", airport.getIata());
        if (isPresent(airport.getIata())) {
            checkIata(failures, "iata", airport.getIata());
        }
        String icao = airport.getIcao();
        if (isPresent(icao) && !ICAO_PATTERN.matcher(icao.trim()).matches()) {
            failures.add(new ValidationFailure(FailureReason.INVALID_CODE, "icao", "not a four-letter code: " + icao));
        }
        withinBounds(failures, "latitude", airport.getLatitude(), MAX_LATITUDE);
        withinBounds(failures, "longitude", airport.getLongitude(), MAX_LONGITUDE);
    }

    private static void required(List<ValidationFailure> failures, String field, Object value) {
        if (value == null || (value instanceof String && ((String) value).isBlank())) {
            failures.add(new ValidationFailure(FailureReason.MISSING_REQUIRED_FIELD, field, "is required"));
        }
    }

    private static void checkIata(List<ValidationFailure> failures, String field, String code) {
        if (!IATA_PATTERN.matcher(code.trim()).matches()) {
            failures.add(new ValidationFailure(FailureReason.INVALID_CODE, field, "not a three-letter IATA code: " + code));
        }
    }

    private static void nonNegative(List<ValidationFailure> failures, String field, Integer value) {
        if (value != null && value < 0) {
            failures.add(new ValidationFailure(FailureReason.NEGATIVE_VALUE, field, "must not be negative but was " + value));
        }
    }

    private static void nonNegative(List<ValidationFailure> failures, String field, BigDecimal value) {
        if (value != null && value.signum() < 0) {
            failures.add(new ValidationFailure(FailureReason.NEGATIVE_VALUE, field, "must not be negative but was " + value));
        }
    }

    private static void withinBounds(List<ValidationFailure> failures, String field, BigDecimal value, BigDecimal bound) {
        if (value != null && value.abs().compareTo(bound) > 0) {
            failures.add(new ValidationFailure(FailureReason.OUT_OF_RANGE, field,
                value + " is outside [-" + bound + ", " + bound + "]"));
        }
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
