package com.airline.warehouse.dimension;

import com.airline.warehouse.config.LoaderProperties;
import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.entity.KeySequence;
import com.airline.warehouse.exception.SurrogateKeyExhaustedException;
import com.airline.warehouse.exception.WarehouseLoadException;
import com.airline.warehouse.repository.KeySequenceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * Allocates keys from the {@code key_sequence} table.
 *
 * <p>Each allocation locks the dimension's sequence row and commits in its own
 * transaction, so the row lock is held only for the increment and a key handed out is
 * burnt whether or not the caller's merge commits.
 */
@Slf4j
@Component
public class TableSurrogateKeyAllocator implements SurrogateKeyAllocator {

    private static final int CREATE_ATTEMPTS = 3;

    private final KeySequenceRepository repository;
    private final LoaderProperties properties;
    private final TransactionTemplate allocationTransaction;

    public TableSurrogateKeyAllocator(KeySequenceRepository repository,
                                      LoaderProperties properties,
                                      PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.properties = properties;
        this.allocationTransaction = new TransactionTemplate(transactionManager);
        this.allocationTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.allocationTransaction.setTimeout((int) Math.max(1, properties.getStorageTimeout().toSeconds()));
    }

    @Override
    public long next(DimensionType type) {
        String sequenceName = type.sequenceName();
        RuntimeException lastRace = null;
        for (int attempt = 0; attempt < CREATE_ATTEMPTS; attempt++) {
            try {
                Long key = allocationTransaction.execute(status -> allocate(sequenceName));
                if (key == null) {
                    throw new WarehouseLoadException("No key returned for sequence " + sequenceName);
                }
                return key;
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                // lost the race to create or lock the sequence row; read it again
                log.debug("Sequence {} contended, retrying", sequenceName);
                lastRace = e;
            }
        }
        throw new WarehouseLoadException("Could not initialize key sequence " + sequenceName, lastRace);
    }

    private Long allocate(String sequenceName) {
        Optional<KeySequence> existing = repository.findForUpdate(sequenceName);
        if (existing.isEmpty()) {
            repository.insertSequence(sequenceName, 2L, properties.getSurrogateKeyMax());
            log.info("Created surrogate key sequence {} (max {})", sequenceName, properties.getSurrogateKeyMax());
            return 1L;
        }
        KeySequence sequence = existing.get();
        long value = sequence.getNextValue();
        if (value > sequence.getMaxValue()) {
            throw new SurrogateKeyExhaustedException(sequenceName, sequence.getMaxValue());
        }
        sequence.setNextValue(value + 1);
        return value;
    }
}
