package com.airline.warehouse.pipeline;

import com.airline.warehouse.entity.KeySequence;
import com.airline.warehouse.exception.BatchAbortedException;
import com.airline.warehouse.exception.SurrogateKeyExhaustedException;
import com.airline.warehouse.ingest.CustomerRecord;
import com.airline.warehouse.ingest.SourceRecord;
import com.airline.warehouse.repository.CustomerDimensionRepository;
import com.airline.warehouse.repository.FlightFactRepository;
import com.airline.warehouse.repository.KeySequenceRepository;
import com.airline.warehouse.validation.FailureReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.jdbc.JdbcTestUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("WarehouseLoadPipeline Tests")
class WarehouseLoadPipelineTest {

    private static final Resource SAMPLE = new ClassPathResource("ingest/sample-load.jsonl");
    private static final LocalDateTime JUNE_1 = LocalDateTime.of(2024, 6, 1, 0, 0);
    private static final LocalDateTime JUNE_2 = LocalDateTime.of(2024, 6, 2, 0, 0);

    @Autowired
    private WarehouseLoadPipeline pipeline;

    @Autowired
    private CustomerDimensionRepository customerRepository;

    @Autowired
    private FlightFactRepository factRepository;

    @Autowired
    private KeySequenceRepository sequenceRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanWarehouse() {
        JdbcTestUtils.deleteFromTables(jdbcTemplate, "fact_flight", "dim_customer", "dim_aircraft", "dim_airport",
            "key_sequence");
    }

    @Test
    @DisplayName("Should load a file end to end and summarize the run")
    void shouldLoadSampleFile() {
        // When
        LoadSummary summary = pipeline.run(SAMPLE, JUNE_1, CancellationSignal.never());

        // Then
        assertThat(summary.getRecordsRead()).isEqualTo(8);
        assertThat(summary.getRecordsValidated()).isEqualTo(5);
        assertThat(summary.getRecordsRejected()).isEqualTo(3);
        assertThat(summary.getRejectionsByReason())
            .containsEntry(FailureReason.MALFORMED_RECORD, 2)
            .containsEntry(FailureReason.SAME_ORIGIN_AND_DESTINATION, 1);
        assertThat(summary.getEntitiesCreated()).isEqualTo(4);
        assertThat(summary.getVersionsCreated()).isZero();
        assertThat(summary.getFactsInserted()).isEqualTo(1);
        assertThat(summary.getFactFailures()).isZero();
        assertThat(summary.getFindings()).hasSize(6).allMatch(finding -> finding.isPassed());
        assertThat(summary.isCancelled()).isFalse();
        assertThat(summary.getRunId()).isNotBlank();
        assertThat(summary.describe()).contains("read=8");

        assertThat(factRepository.findById("FL-100")).isPresent();
        assertThat(factRepository.findById("FL-100").orElseThrow().getLoadFactor()).isEqualByComparingTo("95.00");
    }

    @Test
    @DisplayName("Should change nothing when the same file is loaded twice")
    void shouldBeIdempotentAcrossRuns() {
        // Given
        pipeline.run(SAMPLE, JUNE_1, CancellationSignal.never());

        // When
        LoadSummary replay = pipeline.run(SAMPLE, JUNE_2, CancellationSignal.never());

        // Then
        assertThat(replay.getEntitiesCreated()).isZero();
        assertThat(replay.getVersionsCreated()).isZero();
        assertThat(replay.getDimensionsUnchanged()).isEqualTo(4);
        assertThat(replay.getFactsInserted()).isZero();
        assertThat(replay.getFactsUnchanged()).isEqualTo(1);
        assertThat(customerRepository.findHistory("C-1001")).hasSize(1);
    }

    @Test
    @DisplayName("Should apply several changes to one key in submission order")
    void shouldKeepSubmissionOrderPerKey() {
        // Given
        List<SourceRecord> records = new ArrayList<>();
        records.add(customer("C-7", "Bronze"));
        records.add(customer("C-8", "Bronze"));
        records.add(customer("C-7", "Silver"));
        records.add(customer("C-7", "Gold"));

        // When
        LoadSummary summary = pipeline.run(records, JUNE_1, CancellationSignal.never());

        // Then
        assertThat(summary.getEntitiesCreated()).isEqualTo(2);
        assertThat(summary.getVersionsCreated()).isEqualTo(2);
        assertThat(customerRepository.findHistory("C-7"))
            .extracting(customer -> customer.getLoyaltyTier())
            .containsExactly("Bronze", "Silver", "Gold");
        assertThat(customerRepository.findCurrentByBusinessKey("C-7").orElseThrow().getLoyaltyTier())
            .isEqualTo("Gold");
    }

    @Test
    @DisplayName("Should count an out-of-order change as a merge failure and carry on")
    void shouldCountMergeFailures() {
        // Given
        pipeline.run(List.of(customer("C-9", "Silver")), JUNE_2, CancellationSignal.never());

        // When
        LoadSummary late = pipeline.run(List.of(customer("C-9", "Gold"), customer("C-10", "Gold")), JUNE_1,
            CancellationSignal.never());

        // Then
        assertThat(late.getMergeFailures()).isEqualTo(1);
        assertThat(late.getEntitiesCreated()).isEqualTo(1);
        assertThat(customerRepository.findHistory("C-9")).hasSize(1);
    }

    @Test
    @DisplayName("Should stop before loading when cancelled and skip the audit")
    void shouldHonourCancellation() {
        // Given
        CancellationToken token = new CancellationToken();
        token.cancel();

        // When
        LoadSummary summary = pipeline.run(SAMPLE, JUNE_1, token);

        // Then
        assertThat(summary.isCancelled()).isTrue();
        assertThat(summary.getRecordsRead()).isEqualTo(8);
        assertThat(summary.getRecordsValidated()).isZero();
        assertThat(summary.getFindings()).isEmpty();
        assertThat(customerRepository.count()).isZero();
    }

    @Test
    @DisplayName("Should abort with a partial summary when surrogate keys run out")
    void shouldAbortOnKeyExhaustion() {
        // Given
        sequenceRepository.saveAndFlush(KeySequence.builder()
            .sequenceName("dim_customer_key")
            .nextValue(3L)
            .maxValue(2L)
            .build());
        List<SourceRecord> records = List.of(customer("C-11", "Silver"));

        // When / Then
        assertThatThrownBy(() -> pipeline.run(records, JUNE_1, CancellationSignal.never()))
            .isInstanceOf(BatchAbortedException.class)
            .hasCauseInstanceOf(SurrogateKeyExhaustedException.class)
            .satisfies(e -> {
                LoadSummary partial = ((BatchAbortedException) e).getPartialSummary();
                assertThat(partial.getRecordsRead()).isEqualTo(1);
                assertThat(partial.getRecordsValidated()).isEqualTo(1);
                assertThat(partial.getEntitiesCreated()).isZero();
            });
        assertThat(customerRepository.count()).isZero();
    }

    private static CustomerRecord customer(String id, String tier) {
        return CustomerRecord.builder()
            .customerId(id)
            .firstName("Test")
            .lastName("Traveller")
            .email(id.toLowerCase() + "@example.com")
            .loyaltyTier(tier)
            .loyaltyPoints(500)
            .build();
    }
}
