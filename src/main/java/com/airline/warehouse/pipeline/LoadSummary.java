package com.airline.warehouse.pipeline;

import com.airline.warehouse.quality.QualityFinding;
import com.airline.warehouse.validation.FailureReason;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Counts and findings of one load run. Also produced, partially filled, when a run is
 * cancelled or aborted.
 */
@Value
@Builder(toBuilder = true)
public class LoadSummary {

    String runId;
    LocalDateTime asOf;

    int recordsRead;
    int recordsValidated;
    int recordsRejected;
    @Singular("rejection")
    Map<FailureReason, Integer> rejectionsByReason;

    int entitiesCreated;
    int versionsCreated;
    int dimensionsUnchanged;
    int mergeFailures;

    int factsInserted;
    int factsUpdated;
    int factsUnchanged;
    int factFailures;

    @Singular
    List<QualityFinding> findings;

    boolean cancelled;
    Duration elapsed;

    public long failedFindings() {
        return findings.stream().filter(finding -> !finding.isPassed()).count();
    }

    /**
     * One-line rendering for the run log.
     */
    public String describe() {
        return String.format(
            "read=%d validated=%d rejected=%d %s | dimensions: new=%d versions=%d unchanged=%d failed=%d"
                + " | facts: inserted=%d updated=%d unchanged=%d failed=%d | quality: %d/%d failed%s | %d ms",
            recordsRead, recordsValidated, recordsRejected, rejectionsByReason,
            entitiesCreated, versionsCreated, dimensionsUnchanged, mergeFailures,
            factsInserted, factsUpdated, factsUnchanged, factFailures,
            failedFindings(), findings.size(), cancelled ? " | CANCELLED" : "",
            elapsed == null ? 0 : elapsed.toMillis());
    }
}
