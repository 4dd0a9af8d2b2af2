package com.airline.warehouse.pipeline;

import com.airline.warehouse.dimension.MergeOutcome;
import com.airline.warehouse.fact.UpsertResult;
import com.airline.warehouse.quality.QualityFinding;
import com.airline.warehouse.validation.FailureReason;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Running totals of a load, updated concurrently by the workers.
 */
class LoadCounters {

    private final AtomicInteger read = new AtomicInteger();
    private final AtomicInteger validated = new AtomicInteger();
    private final Map<FailureReason, AtomicInteger> rejections = new EnumMap<>(FailureReason.class);
    private final Map<MergeOutcome, AtomicInteger> merges = new EnumMap<>(MergeOutcome.class);
    private final AtomicInteger mergeFailures = new AtomicInteger();
    private final Map<UpsertResult, AtomicInteger> upserts = new EnumMap<>(UpsertResult.class);
    private final AtomicInteger factFailures = new AtomicInteger();

    LoadCounters() {
        // maps are filled up front and only read afterwards, so workers never resize them
        for (FailureReason reason : FailureReason.values()) {
            rejections.put(reason, new AtomicInteger());
        }
        for (MergeOutcome outcome : MergeOutcome.values()) {
            merges.put(outcome, new AtomicInteger());
        }
        for (UpsertResult result : UpsertResult.values()) {
            upserts.put(result, new AtomicInteger());
        }
    }

    void read(int count) {
        read.addAndGet(count);
    }

    void validated() {
        validated.incrementAndGet();
    }

    void rejected(FailureReason reason) {
        rejections.get(reason).incrementAndGet();
    }

    void merged(MergeOutcome outcome) {
        merges.get(outcome).incrementAndGet();
    }

    void mergeFailed() {
        mergeFailures.incrementAndGet();
    }

    void upserted(UpsertResult result) {
        upserts.get(result).incrementAndGet();
    }

    void factFailed() {
        factFailures.incrementAndGet();
    }

    LoadSummary toSummary(String runId, LocalDateTime asOf, List<QualityFinding> findings,
                          boolean cancelled, Duration elapsed) {
        LoadSummary.LoadSummaryBuilder builder = LoadSummary.builder()
            .runId(runId)
            .asOf(asOf)
            .recordsRead(read.get())
            .recordsValidated(validated.get())
            .entitiesCreated(merges.get(MergeOutcome.NEW_ENTITY).get())
            .versionsCreated(merges.get(MergeOutcome.NEW_VERSION).get())
            .dimensionsUnchanged(merges.get(MergeOutcome.NO_CHANGE).get())
            .mergeFailures(mergeFailures.get())
            .factsInserted(upserts.get(UpsertResult.INSERTED).get())
            .factsUpdated(upserts.get(UpsertResult.UPDATED).get())
            .factsUnchanged(upserts.get(UpsertResult.UNCHANGED).get())
            .factFailures(factFailures.get())
            .findings(findings)
            .cancelled(cancelled)
            .elapsed(elapsed);
        int rejected = 0;
        for (Map.Entry<FailureReason, AtomicInteger> entry : rejections.entrySet()) {
            int count = entry.getValue().get();
            if (count > 0) {
                builder.rejection(entry.getKey(), count);
                rejected += count;
            }
        }
        return builder.recordsRejected(rejected).build();
    }
}
