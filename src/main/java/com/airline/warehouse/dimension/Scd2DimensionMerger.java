package com.airline.warehouse.dimension;

import com.airline.warehouse.config.LoaderProperties;
import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.entity.VersionedDimension;
import com.airline.warehouse.exception.ConcurrentMergeConflictException;
import com.airline.warehouse.exception.MergeConflictException;
import com.airline.warehouse.exception.OutOfOrderChangeException;
import com.airline.warehouse.exception.SurrogateKeyCollisionException;
import com.airline.warehouse.exception.WarehouseLoadException;
import com.airline.warehouse.repository.VersionedDimensionRepository;
import com.airline.warehouse.transform.DimensionSnapshot;
import com.google.common.util.concurrent.Striped;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

/**
 * SCD Type 2 merge of one entity snapshot into its dimension.
 *
 * <p>A merge reads the current version, compares the tracked attributes and, on drift,
 * expires the current row and inserts its successor in one transaction. Writers on the
 * same business key are serialized twice over:
 * <ul>
 *   <li>in this process, by a striped lock taken before the transaction starts and
 *       released after it commits, so versions follow commit order;</li>
 *   <li>across processes, by the conditional expire (it only touches a row that is still
 *       current) and the unique {@code (business key, version number)} constraint.</li>
 * </ul>
 * A writer that loses either race rolls back and the whole unit is retried from a fresh
 * read, never resumed half way.
 */
@Slf4j
@Service
public class Scd2DimensionMerger {

    private final DimensionHandlerRegistry handlers;
    private final SurrogateKeyAllocator keyAllocator;
    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate retryTemplate;
    private final Striped<Lock> keyLocks;
    private final Duration lockTimeout;
    private final int maxAttempts;

    public Scd2DimensionMerger(DimensionHandlerRegistry handlers,
                               SurrogateKeyAllocator keyAllocator,
                               TransactionTemplate transactionTemplate,
                               @Qualifier("writeRetryTemplate") RetryTemplate retryTemplate,
                               Striped<Lock> keyLocks,
                               LoaderProperties properties) {
        this.handlers = handlers;
        this.keyAllocator = keyAllocator;
        this.transactionTemplate = transactionTemplate;
        this.retryTemplate = retryTemplate;
        this.keyLocks = keyLocks;
        this.lockTimeout = properties.getStorageTimeout();
        this.maxAttempts = properties.getMaxConflictRetries();
    }

    public MergeResult mergeEntity(DimensionSnapshot snapshot, LocalDateTime asOf) {
        return mergeEntity(handlers.handlerFor(snapshot.getType()), snapshot.getRow(), asOf);
    }

    /**
     * Merges the incoming state of one entity as of the given time.
     *
     * @throws MergeConflictException when the merge kept conflicting with other writers
     * @throws OutOfOrderChangeException when {@code asOf} precedes the current version
     * @throws com.airline.warehouse.exception.SurrogateKeyExhaustedException fatal
     * @throws SurrogateKeyCollisionException fatal
     */
    public <E extends VersionedDimension> MergeResult mergeEntity(DimensionHandler<E> handler,
                                                                  VersionedDimension incoming,
                                                                  LocalDateTime asOf) {
        E snapshot = handler.rowType().cast(incoming);
        String businessKey = snapshot.getBusinessKey();
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.debug("Retrying merge of {} '{}' (attempt {})",
                        handler.type().configName(), businessKey, context.getRetryCount() + 1);
                }
                return mergeUnderLock(handler, snapshot, asOf);
            });
        } catch (ConcurrentMergeConflictException | DataIntegrityViolationException
                 | TransientDataAccessException | TransactionTimedOutException e) {
            throw new MergeConflictException(handler.type(), businessKey, maxAttempts, e);
        }
    }

    /**
     * Version chain of a business key, oldest first.
     */
    public List<? extends VersionedDimension> history(DimensionType type, String businessKey) {
        return handlers.handlerFor(type).repository().findHistory(businessKey);
    }

    /**
     * The version that was current at the given instant.
     */
    public Optional<? extends VersionedDimension> versionAsOf(DimensionType type, String businessKey,
                                                            LocalDateTime instant) {
        return handlers.handlerFor(type).repository().findVersionAsOf(businessKey, instant);
    }

    private <E extends VersionedDimension> MergeResult mergeUnderLock(DimensionHandler<E> handler, E snapshot,
                                                                      LocalDateTime asOf) {
        String businessKey = snapshot.getBusinessKey();
        Lock lock = keyLocks.get(handler.type().name() + ':' + businessKey);
        boolean locked;
        try {
            locked = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WarehouseLoadException("Interrupted waiting to merge " + businessKey, e);
        }
        if (!locked) {
            throw new ConcurrentMergeConflictException(handler.type(), businessKey,
                "lock not acquired within " + lockTimeout);
        }
        try {
            return transactionTemplate.execute(status -> mergeInTransaction(handler, snapshot, asOf));
        } finally {
            lock.unlock();
        }
    }

    private <E extends VersionedDimension> MergeResult mergeInTransaction(DimensionHandler<E> handler, E snapshot,
                                                                          LocalDateTime asOf) {
        VersionedDimensionRepository<E> repository = handler.repository();
        String businessKey = snapshot.getBusinessKey();

        Optional<E> current = repository.findCurrentByBusinessKey(businessKey);
        if (current.isEmpty()) {
            E created = insertVersion(handler, snapshot, 1, asOf);
            log.debug("New {} '{}' with key {}", handler.type().configName(), businessKey, created.getSurrogateKey());
            return MergeResult.newEntity(created.getSurrogateKey());
        }

        E existing = current.get();
        if (asOf.isBefore(existing.getEffectiveDate())) {
            throw new OutOfOrderChangeException(handler.type(), businessKey, asOf, existing.getEffectiveDate());
        }

        List<String> drifted = handler.driftedAttributes(existing, snapshot);
        if (drifted.isEmpty()) {
            return MergeResult.noChange(existing.getSurrogateKey());
        }

        int expired = repository.expireVersion(existing.getSurrogateKey(), asOf);
        if (expired != 1) {
            throw new ConcurrentMergeConflictException(handler.type(), businessKey,
                "version " + existing.getVersionNumber() + " is no longer current");
        }
        E next = insertVersion(handler, snapshot, existing.getVersionNumber() + 1, asOf);
        log.debug("{} '{}' changed {}; version {} expired, version {} has key {}",
            handler.type().configName(), businessKey, drifted,
            existing.getVersionNumber(), next.getVersionNumber(), next.getSurrogateKey());
        return MergeResult.newVersion(next.getSurrogateKey());
    }

    private <E extends VersionedDimension> E insertVersion(DimensionHandler<E> handler, E snapshot,
                                                           int versionNumber, LocalDateTime asOf) {
        long surrogateKey = keyAllocator.next(handler.type());
        if (handler.repository().existsById(surrogateKey)) {
            throw new SurrogateKeyCollisionException(handler.type(), surrogateKey);
        }
        E row = handler.newVersion(snapshot, surrogateKey, versionNumber, asOf);
        return handler.repository().saveAndFlush(row);
    }
}
