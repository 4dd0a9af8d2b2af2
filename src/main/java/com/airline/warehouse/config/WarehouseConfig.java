package com.airline.warehouse.config;

import com.airline.warehouse.exception.ConcurrentMergeConflictException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.util.concurrent.Striped;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.locks.Lock;

/**
 * Infrastructure beans shared by the merge, fact and audit stages.
 */
@Configuration
public class WarehouseConfig {

    private static final int KEY_LOCK_STRIPES = 1024;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Mapper for the JSONL ingest lines, with {@code java.time} support for flight and join dates.
     */
    @Bean
    public JsonMapper objectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .build();
    }

    /**
     * One transaction per entity merge or fact upsert, bounded by the storage timeout.
     */
    @Bean
    public TransactionTemplate unitOfWorkTransactionTemplate(PlatformTransactionManager transactionManager,
                                                             LoaderProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout(timeoutSeconds(properties));
        return template;
    }

    /**
     * Retries a whole merge or upsert unit on write conflicts and transient storage errors.
     */
    @Bean
    public RetryTemplate writeRetryTemplate(LoaderProperties properties) {
        List<Class<? extends Throwable>> retryable = List.of(
            ConcurrentMergeConflictException.class,
            ConcurrencyFailureException.class,
            DataIntegrityViolationException.class,
            TransientDataAccessException.class,
            TransactionTimedOutException.class);
        return RetryTemplate.builder()
            .maxAttempts(properties.getMaxConflictRetries())
            .exponentialBackoff(properties.getRetryBackoff().toMillis(), 2.0,
                properties.getMaxRetryBackoff().toMillis())
            .retryOn(retryable)
            .build();
    }

    /**
     * Retries read-only audit queries on transient storage errors.
     */
    @Bean
    public RetryTemplate readRetryTemplate(LoaderProperties properties) {
        return RetryTemplate.builder()
            .maxAttempts(properties.getMaxConflictRetries())
            .exponentialBackoff(properties.getRetryBackoff().toMillis(), 2.0,
                properties.getMaxRetryBackoff().toMillis())
            .retryOn(TransientDataAccessException.class)
            .build();
    }

    /**
     * In-process serialization point per dimension business key.
     */
    @Bean
    public Striped<Lock> businessKeyLocks() {
        return Striped.lazyWeakLock(KEY_LOCK_STRIPES);
    }

    @Bean
    public ThreadPoolTaskExecutor loaderTaskExecutor(LoaderProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerThreads());
        executor.setMaxPoolSize(properties.getWorkerThreads());
        executor.setThreadNamePrefix("loader-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    static int timeoutSeconds(LoaderProperties properties) {
        return (int) Math.max(1, properties.getStorageTimeout().toSeconds());
    }
}
