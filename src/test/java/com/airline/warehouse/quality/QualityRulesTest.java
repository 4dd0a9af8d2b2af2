package com.airline.warehouse.quality;

import com.airline.warehouse.entity.AircraftDimension;
import com.airline.warehouse.entity.AirportDimension;
import com.airline.warehouse.entity.CustomerDimension;
import com.airline.warehouse.entity.FlightFact;
import com.airline.warehouse.entity.VersionedDimension;
import com.airline.warehouse.repository.AircraftDimensionRepository;
import com.airline.warehouse.repository.AirportDimensionRepository;
import com.airline.warehouse.repository.CustomerDimensionRepository;
import com.airline.warehouse.repository.FlightFactRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.jdbc.JdbcTestUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * The registered quality rules run against a seeded H2 warehouse.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Quality rule Tests")
class QualityRulesTest {

    private static final LocalDateTime MAY = LocalDateTime.of(2024, 5, 1, 0, 0);

    @Autowired
    private QualityAuditor auditor;

    @Autowired
    private FlightFactRepository factRepository;

    @Autowired
    private AircraftDimensionRepository aircraftRepository;

    @Autowired
    private AirportDimensionRepository airportRepository;

    @Autowired
    private CustomerDimensionRepository customerRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private long aircraftKey;
    private long jfkKey;
    private long laxKey;

    @BeforeEach
    void seedDimensions() {
        JdbcTestUtils.deleteFromTables(jdbcTemplate, "fact_flight", "dim_customer", "dim_aircraft", "dim_airport",
            "key_sequence");
        aircraftKey = aircraftRepository.saveAndFlush(AircraftDimension.builder()
            .surrogateKey(1L).businessKey("N101AA").effectiveDate(MAY).seatingCapacity(160).build())
            .getSurrogateKey();
        jfkKey = airportRepository.saveAndFlush(AirportDimension.builder()
            .surrogateKey(1L).businessKey("JFK").effectiveDate(MAY).build()).getSurrogateKey();
        laxKey = airportRepository.saveAndFlush(AirportDimension.builder()
            .surrogateKey(2L).businessKey("LAX").effectiveDate(MAY).build()).getSurrogateKey();
    }

    @Test
    @DisplayName("Should pass every rule on a consistent warehouse")
    void shouldPassOnCleanWarehouse() {
        // Given
        factRepository.saveAndFlush(fact("FL-1", aircraftKey).build());

        // When
        List<QualityFinding> findings = auditor.audit().collect(Collectors.toList());

        // Then
        assertThat(findings).extracting(QualityFinding::getRuleName).containsExactlyInAnyOrder(
            "orphaned_dimension_references", "invalid_load_factors", "overbooked_flights",
            "future_dated_flights", "multiple_current_versions", "invalid_version_windows");
        assertThat(findings).allMatch(QualityFinding::isPassed);
    }

    @Test
    @DisplayName("Should report a fact that references a missing dimension row")
    void shouldReportOrphanedReference() {
        // Given
        factRepository.saveAndFlush(fact("FL-1", aircraftKey).build());
        factRepository.saveAndFlush(fact("FL-2", 9999L).build());

        // When
        List<QualityFinding> orphaned = auditor.audit()
            .filter(finding -> finding.getRuleName().equals("orphaned_dimension_references"))
            .collect(Collectors.toList());

        // Then
        assertThat(orphaned).hasSize(1);
        assertThat(orphaned.get(0).isPassed()).isFalse();
        assertThat(orphaned.get(0).getViolationCount()).isGreaterThanOrEqualTo(1);
        assertThat(orphaned.get(0).getSeverity()).isEqualTo(QualitySeverity.CRITICAL);
    }

    @Test
    @DisplayName("Should report invalid load factors, overbooking and future dates")
    void shouldReportFactAnomalies() {
        // Given
        factRepository.saveAndFlush(fact("FL-1", aircraftKey).loadFactor(new BigDecimal("120.00")).build());
        factRepository.saveAndFlush(fact("FL-2", aircraftKey).seatsFilled(170).build());
        factRepository.saveAndFlush(fact("FL-3", aircraftKey).flightDate(LocalDate.now().plusDays(30)).build());

        // When
        Map<String, QualityFinding> findings = byRule();

        // Then
        assertThat(findings.get("invalid_load_factors").getViolationCount()).isEqualTo(1);
        assertThat(findings.get("overbooked_flights").getViolationCount()).isEqualTo(1);
        assertThat(findings.get("future_dated_flights").getViolationCount()).isEqualTo(1);
        assertThat(findings.get("orphaned_dimension_references").isPassed()).isTrue();
    }

    @Test
    @DisplayName("Should report broken version chains")
    void shouldReportVersionAnomalies() {
        // Given
        customerRepository.saveAndFlush(customer(10L, 1, true, VersionedDimension.OPEN_END));
        customerRepository.saveAndFlush(customer(11L, 2, true, VersionedDimension.OPEN_END));
        customerRepository.saveAndFlush(customer(12L, 3, false, MAY.minusDays(1)));

        // When
        Map<String, QualityFinding> findings = byRule();

        // Then
        assertThat(findings.get("multiple_current_versions").getViolationCount()).isEqualTo(1);
        assertThat(findings.get("invalid_version_windows").getViolationCount()).isEqualTo(1);
    }

    private Map<String, QualityFinding> byRule() {
        return auditor.audit().collect(Collectors.toMap(QualityFinding::getRuleName, Function.identity()));
    }

    private FlightFact.FlightFactBuilder fact(String key, long aircraft) {
        return FlightFact.builder()
            .flightFactKey(key)
            .flightNumber("AA100")
            .flightDate(LocalDate.of(2024, 6, 1))
            .aircraftKey(aircraft)
            .departureAirportKey(jfkKey)
            .arrivalAirportKey(laxKey)
            .seatsAvailable(160)
            .seatsFilled(120)
            .loadFactor(new BigDecimal("75.00"))
            .onTimeFlag(true);
    }

    private static CustomerDimension customer(long key, int version, boolean current, LocalDateTime expiration) {
        return CustomerDimension.builder()
            .surrogateKey(key)
            .businessKey("C-9")
            .versionNumber(version)
            .effectiveDate(MAY)
            .expirationDate(expiration)
            .isCurrent(current)
            .loyaltyTier("Silver")
            .build();
    }
}
