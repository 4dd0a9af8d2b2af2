package com.airline.warehouse.batch;

import com.airline.warehouse.exception.LoaderConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.test.JobLauncherTestUtils;
import org.springframework.batch.test.context.SpringBatchTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.jdbc.JdbcTestUtils;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBatchTest
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("warehouseLoadJob Tests")
class WarehouseLoadJobTest {

    @Autowired
    private JobLauncherTestUtils jobLauncherTestUtils;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanWarehouse() {
        JdbcTestUtils.deleteFromTables(jdbcTemplate, "fact_flight", "dim_customer", "dim_aircraft", "dim_airport",
            "key_sequence");
    }

    @Test
    @DisplayName("Should load and audit the input file")
    void shouldRunLoadAndAuditSteps() throws Exception {
        // Given
        JobParameters parameters = new JobParametersBuilder()
            .addString(WarehouseLoadJobConfig.INPUT_PARAMETER, "classpath:ingest/sample-load.jsonl")
            .addString(WarehouseLoadJobConfig.AS_OF_PARAMETER, "2024-06-01T00:00:00")
            .addLong("launch", System.nanoTime())
            .toJobParameters();

        // When
        JobExecution execution = jobLauncherTestUtils.launchJob(parameters);

        // Then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        Map<String, StepExecution> steps = execution.getStepExecutions().stream()
            .collect(Collectors.toMap(StepExecution::getStepName, Function.identity()));
        assertThat(steps).containsOnlyKeys("loadStep", "auditStep");

        StepExecution load = steps.get("loadStep");
        ExecutionContext loadContext = load.getExecutionContext();
        assertThat(loadContext.getInt("recordsRead")).isEqualTo(8);
        assertThat(loadContext.getInt("recordsRejected")).isEqualTo(3);
        assertThat(loadContext.getInt("entitiesCreated")).isEqualTo(4);
        assertThat(loadContext.getInt("factsInserted")).isEqualTo(1);
        assertThat(load.getFilterCount()).isEqualTo(3);
        assertThat(load.getWriteCount()).isEqualTo(5);

        ExecutionContext auditContext = steps.get("auditStep").getExecutionContext();
        assertThat(auditContext.getInt("qualityChecks")).isEqualTo(6);
        assertThat(auditContext.getLong("qualityChecksFailed")).isZero();
        assertThat(auditContext.getLong("quality.orphaned_dimension_references")).isZero();
    }

    @Test
    @DisplayName("Should fail without an input file")
    void shouldFailWithoutInput() throws Exception {
        // Given
        JobParameters parameters = new JobParametersBuilder()
            .addLong("launch", System.nanoTime())
            .toJobParameters();

        // When
        JobExecution execution = jobLauncherTestUtils.launchJob(parameters);

        // Then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(execution.getAllFailureExceptions())
            .anyMatch(e -> e instanceof LoaderConfigurationException);
    }

    @Test
    @DisplayName("Should fail when the input file does not exist")
    void shouldFailOnMissingFile() throws Exception {
        // Given
        JobParameters parameters = new JobParametersBuilder()
            .addString(WarehouseLoadJobConfig.INPUT_PARAMETER, "/nonexistent/flights.jsonl")
            .addLong("launch", System.nanoTime())
            .toJobParameters();

        // When
        JobExecution execution = jobLauncherTestUtils.launchJob(parameters);

        // Then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(execution.getStepExecutions())
            .extracting(StepExecution::getStepName)
            .containsExactly("loadStep");
    }
}
