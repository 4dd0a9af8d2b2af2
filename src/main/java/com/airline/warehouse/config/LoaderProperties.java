package com.airline.warehouse.config;

import com.airline.warehouse.entity.DimensionType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Binding for the loader's settings.
 *
 * <pre>
 * warehouse:
 *   loader:
 *     input: /data/incoming/2024-06-01.jsonl
 *     worker-threads: 4
 *     storage-timeout: 30s
 *     max-conflict-retries: 5
 *     retry-backoff: 50ms
 *     max-retry-backoff: 2s
 *     on-time-threshold-minutes: 15
 *     surrogate-key-max: 2147483647
 *     tracked-attributes:
 *       customer: loyaltyTier,email
 * </pre>
 *
 * <p>Constraint violations fail application startup.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "warehouse.loader")
public class LoaderProperties {

    /** JSONL file read by the batch job when no {@code input} job parameter is given. */
    private String input;

    @Min(1)
    @Max(64)
    private int workerThreads = 4;

    /** Transaction and lock-wait timeout of one entity merge or fact upsert. */
    @NotNull
    private Duration storageTimeout = Duration.ofSeconds(30);

    /** Attempts per merge or upsert before it is reported as failed. */
    @Min(1)
    private int maxConflictRetries = 5;

    @NotNull
    private Duration retryBackoff = Duration.ofMillis(50);

    @NotNull
    private Duration maxRetryBackoff = Duration.ofSeconds(2);

    /** Arrival delay, in minutes, up to which a flight counts as on time. */
    @Min(0)
    private int onTimeThresholdMinutes = 15;

    /** Largest surrogate key a new sequence may hand out. */
    @Min(1)
    private long surrogateKeyMax = Integer.MAX_VALUE;

    /**
     * Attributes whose change opens a new dimension version, keyed by dimension
     * ({@code customer}, {@code aircraft}, {@code airport}). Dimensions left out use
     * their handler's defaults.
     */
    private Map<String, List<String>> trackedAttributes = new HashMap<>();

    public List<String> trackedAttributesFor(DimensionType type, List<String> defaults) {
        List<String> configured = trackedAttributes.get(type.configName());
        return configured == null || configured.isEmpty() ? defaults : configured;
    }
}
