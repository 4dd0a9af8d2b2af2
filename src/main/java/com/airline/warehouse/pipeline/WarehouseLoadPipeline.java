package com.airline.warehouse.pipeline;

import com.airline.warehouse.dimension.MergeResult;
import com.airline.warehouse.dimension.Scd2DimensionMerger;
import com.airline.warehouse.exception.BatchAbortedException;
import com.airline.warehouse.exception.FactRevisionRejectedException;
import com.airline.warehouse.exception.MergeConflictException;
import com.airline.warehouse.exception.OutOfOrderChangeException;
import com.airline.warehouse.exception.UnresolvedReferenceException;
import com.airline.warehouse.fact.FlightFactLoader;
import com.airline.warehouse.fact.UpsertResult;
import com.airline.warehouse.ingest.JsonlSourceReader;
import com.airline.warehouse.ingest.SourceRecord;
import com.airline.warehouse.quality.QualityAuditor;
import com.airline.warehouse.quality.QualityFinding;
import com.airline.warehouse.transform.DimensionSnapshot;
import com.airline.warehouse.transform.RecordTransformer;
import com.airline.warehouse.transform.TransformedFlight;
import com.airline.warehouse.transform.TransformedRecord;
import com.airline.warehouse.util.MdcPropagation;
import com.airline.warehouse.validation.RecordValidator;
import com.airline.warehouse.validation.ValidationResult;
import com.google.common.base.Stopwatch;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.io.Resource;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs one load: validate, transform, merge dimensions, upsert facts, audit.
 *
 * <p>All dimension snapshots are merged before any fact is loaded, so facts of the same
 * batch resolve against the versions it creates. Within a stage records are grouped by
 * key: a key's records are applied in submission order on a single worker, different keys
 * run in parallel on the loader's executor.
 *
 * <p>Per-record failures (validation, merge conflicts, unresolved references, storage
 * errors and timeouts of a single record) are counted and the run carries on. Anything
 * else stops the run with a {@link BatchAbortedException} holding the counts reached so far.
 */
@Slf4j
@Service
public class WarehouseLoadPipeline {

    private final RecordValidator validator;
    private final RecordTransformer transformer;
    private final Scd2DimensionMerger dimensionMerger;
    private final FlightFactLoader factLoader;
    private final QualityAuditor auditor;
    private final JsonlSourceReader reader;
    private final ThreadPoolTaskExecutor executor;

    public WarehouseLoadPipeline(RecordValidator validator,
                                 RecordTransformer transformer,
                                 Scd2DimensionMerger dimensionMerger,
                                 FlightFactLoader factLoader,
                                 QualityAuditor auditor,
                                 JsonlSourceReader reader,
                                 ThreadPoolTaskExecutor loaderTaskExecutor) {
        this.validator = validator;
        this.transformer = transformer;
        this.dimensionMerger = dimensionMerger;
        this.factLoader = factLoader;
        this.auditor = auditor;
        this.reader = reader;
        this.executor = loaderTaskExecutor;
    }

    public LoadSummary run(Resource input, LocalDateTime asOf, CancellationSignal cancellation) {
        return run(newRunId(), reader.readAll(input), asOf, cancellation);
    }

    public LoadSummary run(List<SourceRecord> records, LocalDateTime asOf, CancellationSignal cancellation) {
        return run(newRunId(), records, asOf, cancellation);
    }

    /**
     * Loads the records and audits the result. The audit is skipped when the run was
     * cancelled.
     */
    public LoadSummary run(String runId, List<SourceRecord> records, LocalDateTime asOf,
                           CancellationSignal cancellation) {
        LoadSummary loaded = load(runId, records, asOf, cancellation);
        if (loaded.isCancelled()) {
            return loaded;
        }
        return withRunId(runId, () -> {
            LoadSummary audited = loaded.toBuilder().findings(audit()).build();
            log.info("Load {} audited: {} of {} quality checks failed",
                runId, audited.failedFindings(), audited.getFindings().size());
            return audited;
        });
    }

    public LoadSummary load(String runId, Resource input, LocalDateTime asOf, CancellationSignal cancellation) {
        List<SourceRecord> records = withRunId(runId, () -> reader.readAll(input));
        return load(runId, records, asOf, cancellation);
    }

    /**
     * Loads the records without auditing.
     *
     * @throws BatchAbortedException on a fatal error, e.g. surrogate key exhaustion
     */
    public LoadSummary load(String runId, List<SourceRecord> records, LocalDateTime asOf,
                            CancellationSignal cancellation) {
        return withRunId(runId, () -> doLoad(runId, records, asOf, cancellation));
    }

    public List<QualityFinding> audit() {
        return auditor.audit().collect(Collectors.toList());
    }

    private LoadSummary doLoad(String runId, List<SourceRecord> records, LocalDateTime asOf,
                               CancellationSignal cancellation) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        LoadCounters counters = new LoadCounters();
        AtomicBoolean aborted = new AtomicBoolean();
        CancellationSignal stop = () -> cancellation.isCancelled() || aborted.get();
        log.info("Load {} started: {} records as of {}", runId, records.size(), asOf);

        try {
            counters.read(records.size());
            List<DimensionSnapshot> snapshots = new ArrayList<>();
            List<TransformedFlight> flights = new ArrayList<>();
            for (SourceRecord record : records) {
                if (stop.isCancelled()) {
                    break;
                }
                ValidationResult validation = validator.validate(record);
                if (!validation.isValid()) {
                    counters.rejected(validation.primaryReason());
                    log.warn("Rejected {} record {}: {}", record == null ? "null" : record.getKind(),
                        record == null ? null : record.getRecordKey(), validation.reason());
                    continue;
                }
                counters.validated();
                TransformedRecord transformed = transformer.transform(record);
                if (transformed instanceof DimensionSnapshot) {
                    snapshots.add((DimensionSnapshot) transformed);
                } else {
                    flights.add((TransformedFlight) transformed);
                }
            }

            runGrouped(snapshots, snapshot -> snapshot.getType().name() + ':' + snapshot.getKey(),
                snapshot -> mergeDimension(snapshot, asOf, counters), stop, aborted);
            runGrouped(flights, TransformedFlight::getKey,
                flight -> upsertFact(flight, counters), stop, aborted);
        } catch (RuntimeException e) {
            LoadSummary partial = counters.toSummary(runId, asOf, List.of(), cancellation.isCancelled(),
                stopwatch.elapsed());
            log.error("Load {} aborted: {}", runId, partial.describe(), e);
            throw new BatchAbortedException(partial, e);
        }

        LoadSummary summary = counters.toSummary(runId, asOf, List.of(), cancellation.isCancelled(),
            stopwatch.elapsed());
        if (summary.isCancelled()) {
            log.warn("Load {} cancelled: {}", runId, summary.describe());
        } else {
            log.info("Load {} finished: {}", runId, summary.describe());
        }
        return summary;
    }

    private void mergeDimension(DimensionSnapshot snapshot, LocalDateTime asOf, LoadCounters counters) {
        try {
            MergeResult result = dimensionMerger.mergeEntity(snapshot, asOf);
            counters.merged(result.getOutcome());
        } catch (MergeConflictException | OutOfOrderChangeException | DataAccessException
                 | TransactionException e) {
            counters.mergeFailed();
            log.warn("{} '{}' not merged: {}", snapshot.getType().configName(), snapshot.getKey(), e.getMessage());
        }
    }

    private void upsertFact(TransformedFlight flight, LoadCounters counters) {
        try {
            UpsertResult result = factLoader.upsertFact(flight);
            counters.upserted(result);
        } catch (UnresolvedReferenceException | FactRevisionRejectedException | DataAccessException
                 | TransactionException e) {
            counters.factFailed();
            log.warn("Flight {} not loaded: {}", flight.getFlightFactKey(), e.getMessage());
        }
    }

    /**
     * Applies {@code work} to every item, one worker per key, and waits for all of them. The
     * first fatal error raises {@code aborted} so the other workers stop at their next item.
     */
    private <T> void runGrouped(List<T> items, Function<T, String> keyOf, Consumer<T> work,
                                CancellationSignal stop, AtomicBoolean aborted) {
        Map<String, List<T>> groups = items.stream()
            .collect(Collectors.groupingBy(keyOf, LinkedHashMap::new, Collectors.toList()));

        List<CompletableFuture<Void>> futures = new ArrayList<>(groups.size());
        for (List<T> group : groups.values()) {
            futures.add(CompletableFuture.runAsync(MdcPropagation.wrapRunnable(() -> {
                for (T item : group) {
                    if (stop.isCancelled()) {
                        return;
                    }
                    try {
                        work.accept(item);
                    } catch (RuntimeException e) {
                        aborted.set(true);
                        throw e;
                    }
                }
            }), executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private static <T> T withRunId(String runId, Supplier<T> action) {
        String previous = MDC.get(MdcPropagation.RUN_ID);
        MDC.put(MdcPropagation.RUN_ID, runId);
        try {
            return action.get();
        } finally {
            if (previous == null) {
                MDC.remove(MdcPropagation.RUN_ID);
            } else {
                MDC.put(MdcPropagation.RUN_ID, previous);
            }
        }
    }

    private static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
