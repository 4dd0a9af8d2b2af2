package com.airline.warehouse.batch;

import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.support.transaction.ResourcelessTransactionManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The warehouse load as a Spring Batch job: {@code loadStep} then {@code auditStep}.
 *
 * <p>The tasklets do not run inside a batch transaction. Each merge and upsert commits on
 * its own, on the loader's worker threads.
 */
@Configuration
public class WarehouseLoadJobConfig {

    public static final String JOB_NAME = "warehouseLoadJob";
    public static final String INPUT_PARAMETER = "input";
    public static final String AS_OF_PARAMETER = "asOf";

    @Bean
    public Job warehouseLoadJob(JobRepository jobRepository, Step loadStep, Step auditStep) {
        return new JobBuilder(JOB_NAME, jobRepository)
            .incrementer(new RunIdIncrementer())
            .start(loadStep)
            .next(auditStep)
            .build();
    }

    @Bean
    public Step loadStep(JobRepository jobRepository, LoadTasklet loadTasklet) {
        return new StepBuilder("loadStep", jobRepository)
            .tasklet(loadTasklet, new ResourcelessTransactionManager())
            .build();
    }

    @Bean
    public Step auditStep(JobRepository jobRepository, AuditTasklet auditTasklet) {
        return new StepBuilder("auditStep", jobRepository)
            .tasklet(auditTasklet, new ResourcelessTransactionManager())
            .build();
    }
}
