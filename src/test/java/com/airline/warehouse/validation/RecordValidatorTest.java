package com.airline.warehouse.validation;

import com.airline.warehouse.ingest.AircraftRecord;
import com.airline.warehouse.ingest.AirportRecord;
import com.airline.warehouse.ingest.CustomerRecord;
import com.airline.warehouse.ingest.FlightRecord;
import com.airline.warehouse.ingest.MalformedRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RecordValidator Unit Tests")
class RecordValidatorTest {

    private final RecordValidator validator = new RecordValidator();

    @Test
    @DisplayName("Should accept a complete flight")
    void shouldAcceptCompleteFlight() {
        // When
        ValidationResult result = validator.validate(flight().build());

        // Then
        assertThat(result.isValid()).isTrue();
        assertThat(result.getFailures()).isEmpty();
    }

    @Test
    @DisplayName("Should accept a full flight where seats filled equals seats available")
    void shouldAcceptFullFlight() {
        // Given
        FlightRecord full = flight().seatsAvailable(180).seatsFilled(180).build();

        // When
        ValidationResult result = validator.validate(full);

        // Then
        assertThat(result.isValid()).isTrue();
    }

    @Test
    @DisplayName("Should reject a flight with more seats filled than available")
    void shouldRejectOverbookedFlight() {
        // Given
        FlightRecord overbooked = flight().seatsAvailable(180).seatsFilled(181).build();

        // When
        ValidationResult result = validator.validate(overbooked);

        // Then
        assertThat(result.isValid()).isFalse();
        assertThat(result.primaryReason()).isEqualTo(FailureReason.SEATS_EXCEED_CAPACITY);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("Should reject a flight without positive capacity")
    void shouldRejectNonPositiveCapacity(int seatsAvailable) {
        // Given
        FlightRecord flight = flight().seatsAvailable(seatsAvailable).seatsFilled(0).build();

        // When
        ValidationResult result = validator.validate(flight);

        // Then
        assertThat(result.isValid()).isFalse();
        assertThat(result.getFailures())
            .extracting(ValidationFailure::getReason)
            .contains(FailureReason.NON_POSITIVE_CAPACITY);
    }

    @Test
    @DisplayName("Should reject a flight that departs and arrives at the same airport")
    void shouldRejectSameOriginAndDestination() {
        // Given
        FlightRecord loop = flight().departureAirport("JFK").arrivalAirport("jfk").build();

        // When
        ValidationResult result = validator.validate(loop);

        // Then
        assertThat(result.primaryReason()).isEqualTo(FailureReason.SAME_ORIGIN_AND_DESTINATION);
    }

    @Test
    @DisplayName("Should report every missing required flight field")
    void shouldReportMissingFlightFields() {
        // Given
        FlightRecord empty = FlightRecord.builder().flightFactKey(" ").build();

        // When
        ValidationResult result = validator.validate(empty);

        // Then
        assertThat(result.getFailures())
            .filteredOn(failure -> failure.getReason() == FailureReason.MISSING_REQUIRED_FIELD)
            .extracting(ValidationFailure::getField)
            .containsExactly("flightFactKey", "flightNumber", "flightDate", "tailNumber",
                "departureAirport", "arrivalAirport", "seatsAvailable", "seatsFilled");
    }

    @Test
    @DisplayName("Should reject negative money and distance")
    void shouldRejectNegativeMeasures() {
        // Given
        FlightRecord flight = flight()
            .revenue(new BigDecimal("-1.00"))
            .fuelCost(new BigDecimal("-0.01"))
            .distanceMiles(-5)
            .build();

        // When
        ValidationResult result = validator.validate(flight);

        // Then
        assertThat(result.getFailures())
            .extracting(ValidationFailure::getField)
            .containsExactly("distanceMiles", "revenue", "fuelCost");
    }

    @Test
    @DisplayName("Should reject a customer with an invalid email and negative points")
    void shouldRejectInvalidCustomer() {
        // Given
        CustomerRecord customer = CustomerRecord.builder()
            .customerId("C-1")
            .email("not-an-address")
            .loyaltyPoints(-10)
            .build();

        // When
        ValidationResult result = validator.validate(customer);

        // Then
        assertThat(result.getFailures())
            .extracting(ValidationFailure::getReason)
            .containsExactlyInAnyOrder(FailureReason.INVALID_FORMAT, FailureReason.NEGATIVE_VALUE);
    }

    @Test
    @DisplayName("Should require a tail number and positive seating capacity on aircraft")
    void shouldRejectInvalidAircraft() {
        // Given
        AircraftRecord aircraft = AircraftRecord.builder().seatingCapacity(0).build();

        // When
        ValidationResult result = validator.validate(aircraft);

        // Then
        assertThat(result.getFailures())
            .extracting(ValidationFailure::getReason)
            .containsExactly(FailureReason.MISSING_REQUIRED_FIELD, FailureReason.NON_POSITIVE_CAPACITY);
    }

    @Test
    @DisplayName("Should check airport codes and coordinates")
    void shouldRejectInvalidAirport() {
        // Given
        AirportRecord airport = AirportRecord.builder()
            .iata("JFKX")
            .icao("KJ1")
            .latitude(new BigDecimal("90.000001"))
            .longitude(new BigDecimal("-180"))
            .build();

        // When
        ValidationResult result = validator.validate(airport);

        // Then
        assertThat(result.getFailures())
            .extracting(ValidationFailure::getField)
            .containsExactly("iata", "icao", "latitude");
    }

    @Test
    @DisplayName("Should reject malformed and null records without throwing")
    void shouldRejectMalformedRecords() {
        // When
        ValidationResult malformed = validator.validate(new MalformedRecord(7, "Unexpected character"));
        ValidationResult missing = validator.validate(null);

        // Then
        assertThat(malformed.primaryReason()).isEqualTo(FailureReason.MALFORMED_RECORD);
        assertThat(malformed.reason()).contains("line 7");
        assertThat(missing.primaryReason()).isEqualTo(FailureReason.MALFORMED_RECORD);
    }

    private static FlightRecord.FlightRecordBuilder flight() {
        return FlightRecord.builder()
            .flightFactKey("FL-100")
            .flightNumber("AA100")
            .carrierCode("AA")
            .flightDate(LocalDate.of(2024, 6, 1))
            .tailNumber("N101AA")
            .departureAirport("JFK")
            .arrivalAirport("LAX")
            .departureDelayMin(5)
            .arrivalDelayMin(10)
            .seatsAvailable(180)
            .seatsFilled(150)
            .revenue(new BigDecimal("42000.00"))
            .fuelCost(new BigDecimal("9100.50"))
            .distanceMiles(2475);
    }
}
