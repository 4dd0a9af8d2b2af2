package com.airline.warehouse.dimension;

import com.airline.warehouse.entity.AircraftDimension;
import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.repository.AircraftDimensionRepository;
import com.airline.warehouse.transform.DimensionSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.jdbc.JdbcTestUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Scd2DimensionMerger Concurrency Tests")
class Scd2DimensionMergerConcurrencyTest {

    private static final int WRITERS = 8;
    private static final LocalDateTime AS_OF = LocalDateTime.of(2024, 6, 1, 12, 0);

    @Autowired
    private Scd2DimensionMerger merger;

    @Autowired
    private AircraftDimensionRepository aircraftRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanWarehouse() {
        JdbcTestUtils.deleteFromTables(jdbcTemplate, "fact_flight", "dim_customer", "dim_aircraft", "dim_airport",
            "key_sequence");
    }

    @Test
    @DisplayName("Should keep one version per concurrent change and exactly one current row")
    void shouldNotLoseOrDuplicateVersions() throws Exception {
        // Given
        ExecutorService pool = Executors.newFixedThreadPool(WRITERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<MergeResult>> results = new ArrayList<>();

        try {
            for (int i = 0; i < WRITERS; i++) {
                DimensionSnapshot snapshot = aircraft("N500XA", 100 + i);
                results.add(pool.submit(() -> {
                    start.await();
                    return merger.mergeEntity(snapshot, AS_OF);
                }));
            }

            // When
            start.countDown();
            List<MergeResult> outcomes = new ArrayList<>();
            for (Future<MergeResult> result : results) {
                outcomes.add(result.get(60, TimeUnit.SECONDS));
            }

            // Then
            assertThat(outcomes)
                .extracting(MergeResult::getOutcome)
                .containsOnly(MergeOutcome.NEW_ENTITY, MergeOutcome.NEW_VERSION)
                .filteredOn(outcome -> outcome == MergeOutcome.NEW_ENTITY)
                .hasSize(1);

            List<AircraftDimension> history = aircraftRepository.findHistory("N500XA");
            assertThat(history).hasSize(WRITERS);
            assertThat(history)
                .extracting(AircraftDimension::getVersionNumber)
                .containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
            assertThat(history).filteredOn(AircraftDimension::getIsCurrent).hasSize(1);
            assertThat(history.get(WRITERS - 1).getIsCurrent()).isTrue();
            assertThat(history)
                .extracting(AircraftDimension::getSeatingCapacity)
                .doesNotHaveDuplicates();
            assertThat(aircraftRepository.findBusinessKeysWithMultipleCurrentVersions()).isEmpty();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should merge different business keys in parallel")
    void shouldMergeDistinctKeysInParallel() throws Exception {
        // Given
        ExecutorService pool = Executors.newFixedThreadPool(WRITERS);
        List<Future<MergeResult>> results = new ArrayList<>();

        try {
            // When
            for (int i = 0; i < WRITERS; i++) {
                DimensionSnapshot snapshot = aircraft("N60" + i + "XA", 150);
                results.add(pool.submit(() -> merger.mergeEntity(snapshot, AS_OF)));
            }
            List<Long> keys = new ArrayList<>();
            for (Future<MergeResult> result : results) {
                keys.add(result.get(60, TimeUnit.SECONDS).getSurrogateKey());
            }

            // Then
            assertThat(keys).doesNotHaveDuplicates();
            assertThat(aircraftRepository.countCurrent()).isEqualTo(WRITERS);
        } finally {
            pool.shutdownNow();
        }
    }

    private static DimensionSnapshot aircraft(String tailNumber, int seatingCapacity) {
        return new DimensionSnapshot(DimensionType.AIRCRAFT, AircraftDimension.builder()
            .businessKey(tailNumber)
            .aircraftType("Narrowbody")
            .manufacturer("Airbus")
            .model("A320")
            .seatingCapacity(seatingCapacity)
            .ownershipType("Leased")
            .maintenanceCycle("A-Check")
            .build());
    }
}
