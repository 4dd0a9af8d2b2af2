package com.airline.warehouse.fact;

import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.entity.FlightFact;
import com.airline.warehouse.exception.FactRevisionRejectedException;
import com.airline.warehouse.exception.UnresolvedReferenceException;
import com.airline.warehouse.repository.FlightFactRepository;
import com.airline.warehouse.transform.RecordTransformer;
import com.airline.warehouse.transform.TransformedFlight;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Inserts or revises rows of the flight fact table.
 *
 * <p>A fact is identified by its flight fact key. The first load inserts it with the
 * dimension keys valid on the flight date; later loads only revise the delay, seats
 * filled, load factor and on-time measures. Dimension keys and the other columns of an
 * existing row are never rewritten.
 */
@Slf4j
@Service
public class FlightFactLoader {

    private final FlightFactRepository factRepository;
    private final DimensionKeyResolver keyResolver;
    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate retryTemplate;

    public FlightFactLoader(FlightFactRepository factRepository,
                            DimensionKeyResolver keyResolver,
                            TransactionTemplate transactionTemplate,
                            @Qualifier("writeRetryTemplate") RetryTemplate retryTemplate) {
        this.factRepository = factRepository;
        this.keyResolver = keyResolver;
        this.transactionTemplate = transactionTemplate;
        this.retryTemplate = retryTemplate;
    }

    /**
     * Upserts one flight in its own transaction. A concurrent insert of the same key makes
     * the loser retry, and the retry takes the update path.
     *
     * @throws UnresolvedReferenceException when the aircraft or an airport is unknown
     * @throws FactRevisionRejectedException when a revision changes or exceeds the stored capacity
     * @throws DataAccessException when storage kept failing after the retries
     */
    public UpsertResult upsertFact(TransformedFlight flight) {
        return retryTemplate.execute(context -> transactionTemplate.execute(status -> upsertInTransaction(flight)));
    }

    public FactLoadReport loadBatch(List<TransformedFlight> flights) {
        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        Map<String, String> failures = new LinkedHashMap<>();

        for (TransformedFlight flight : flights) {
            try {
                UpsertResult result = upsertFact(flight);
                if (result == UpsertResult.INSERTED) {
                    inserted++;
                } else if (result == UpsertResult.UPDATED) {
                    updated++;
                } else {
                    unchanged++;
                }
            } catch (UnresolvedReferenceException | FactRevisionRejectedException | DataAccessException
                     | TransactionException e) {
                log.warn("Flight {} not loaded: {}", flight.getFlightFactKey(), e.getMessage());
                failures.put(flight.getFlightFactKey(), e.getMessage());
            }
        }

        log.info("Fact batch: {} inserted, {} updated, {} unchanged, {} failed",
            inserted, updated, unchanged, failures.size());
        return new FactLoadReport(inserted, updated, unchanged, failures);
    }

    private UpsertResult upsertInTransaction(TransformedFlight flight) {
        Optional<FlightFact> existing = factRepository.findForUpdate(flight.getFlightFactKey());
        if (existing.isEmpty()) {
            factRepository.saveAndFlush(newFact(flight));
            log.debug("Inserted flight {}", flight.getFlightFactKey());
            return UpsertResult.INSERTED;
        }

        FlightFact fact = existing.get();
        checkRevisionFits(fact, flight);
        BigDecimal loadFactor = RecordTransformer.loadFactor(flight.getSeatsFilled(), fact.getSeatsAvailable());
        if (sameRevisableMeasures(fact, flight, loadFactor)) {
            return UpsertResult.UNCHANGED;
        }
        fact.setDepartureDelayMin(flight.getDepartureDelayMin());
        fact.setArrivalDelayMin(flight.getArrivalDelayMin());
        fact.setSeatsFilled(flight.getSeatsFilled());
        fact.setLoadFactor(loadFactor);
        fact.setOnTimeFlag(flight.isOnTime());
        factRepository.flush();
        log.debug("Revised flight {}", flight.getFlightFactKey());
        return UpsertResult.UPDATED;
    }

    private FlightFact newFact(TransformedFlight flight) {
        String factKey = flight.getFlightFactKey();
        return FlightFact.builder()
            .flightFactKey(factKey)
            .flightNumber(flight.getFlightNumber())
            .carrierCode(flight.getCarrierCode())
            .flightDate(flight.getFlightDate())
            .aircraftKey(keyResolver.resolve(factKey, DimensionType.AIRCRAFT,
                flight.getTailNumber(), flight.getFlightDate()))
            .departureAirportKey(keyResolver.resolve(factKey, DimensionType.AIRPORT,
                flight.getDepartureAirport(), flight.getFlightDate()))
            .arrivalAirportKey(keyResolver.resolve(factKey, DimensionType.AIRPORT,
                flight.getArrivalAirport(), flight.getFlightDate()))
            .departureDelayMin(flight.getDepartureDelayMin())
            .arrivalDelayMin(flight.getArrivalDelayMin())
            .seatsAvailable(flight.getSeatsAvailable())
            .seatsFilled(flight.getSeatsFilled())
            .loadFactor(flight.getLoadFactor())
            .onTimeFlag(flight.isOnTime())
            .revenue(flight.getRevenue())
            .fuelCost(flight.getFuelCost())
            .distanceMiles(flight.getDistanceMiles())
            .cancellationFlag(flight.isCancelled())
            .build();
    }

    /**
     * Seats available is not revisable, so a revision must keep the stored capacity and
     * stay within it.
     */
    private static void checkRevisionFits(FlightFact fact, TransformedFlight flight) {
        int storedCapacity = fact.getSeatsAvailable();
        if (flight.getSeatsAvailable() != storedCapacity) {
            throw new FactRevisionRejectedException(fact.getFlightFactKey(),
                "seats available " + flight.getSeatsAvailable() + " differs from stored " + storedCapacity);
        }
        if (flight.getSeatsFilled() > storedCapacity) {
            throw new FactRevisionRejectedException(fact.getFlightFactKey(),
                flight.getSeatsFilled() + " seats filled exceed " + storedCapacity + " available");
        }
    }

    private static boolean sameRevisableMeasures(FlightFact fact, TransformedFlight flight, BigDecimal loadFactor) {
        return Objects.equals(fact.getDepartureDelayMin(), flight.getDepartureDelayMin())
            && Objects.equals(fact.getArrivalDelayMin(), flight.getArrivalDelayMin())
            && Objects.equals(fact.getSeatsFilled(), flight.getSeatsFilled())
            && Objects.equals(fact.getOnTimeFlag(), flight.isOnTime())
            && sameDecimal(fact.getLoadFactor(), loadFactor);
    }

    private static boolean sameDecimal(BigDecimal a, BigDecimal b) {
        return a == null ? b == null : b != null && a.compareTo(b) == 0;
    }
}
