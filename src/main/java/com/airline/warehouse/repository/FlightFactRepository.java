package com.airline.warehouse.repository;

import com.airline.warehouse.entity.FlightFact;
import com.airline.warehouse.reporting.RoutePerformance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for flight facts, including the aggregate reads used by the quality
 * rules and the reporting views.
 */
@Repository
public interface FlightFactRepository extends JpaRepository<FlightFact, String> {

    /**
     * Load a fact row and hold a write lock on it until the transaction ends
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM FlightFact f WHERE f.flightFactKey = :flightFactKey")
    Optional<FlightFact> findForUpdate(@Param("flightFactKey") String flightFactKey);

    @Query("SELECT COUNT(f) FROM FlightFact f WHERE "
        + "NOT EXISTS (SELECT a FROM AircraftDimension a WHERE a.surrogateKey = f.aircraftKey) "
        + "OR NOT EXISTS (SELECT d FROM AirportDimension d WHERE d.surrogateKey = f.departureAirportKey) "
        + "OR NOT EXISTS (SELECT r FROM AirportDimension r WHERE r.surrogateKey = f.arrivalAirportKey)")
    long countOrphanedDimensionReferences();

    @Query("SELECT COUNT(f) FROM FlightFact f WHERE f.loadFactor < 0 OR f.loadFactor > 100")
    long countLoadFactorOutOfRange();

    @Query("SELECT COUNT(f) FROM FlightFact f WHERE f.seatsFilled > f.seatsAvailable")
    long countOverbooked();

    @Query("SELECT COUNT(f) FROM FlightFact f WHERE f.flightDate > :today")
    long countFlightsDatedAfter(@Param("today") LocalDate today);

    /**
     * On-time performance per route, cancelled flights excluded
     */
    @Query("SELECT new com.airline.warehouse.reporting.RoutePerformance("
        + "dep.businessKey, arr.businessKey, COUNT(f), "
        + "SUM(CASE WHEN f.onTimeFlag = true THEN 1 ELSE 0 END), "
        + "AVG(f.arrivalDelayMin), AVG(f.departureDelayMin), AVG(f.loadFactor)) "
        + "FROM FlightFact f, AirportDimension dep, AirportDimension arr "
        + "WHERE f.departureAirportKey = dep.surrogateKey AND f.arrivalAirportKey = arr.surrogateKey "
        + "AND f.cancellationFlag = false "
        + "GROUP BY dep.businessKey, arr.businessKey "
        + "ORDER BY dep.businessKey, arr.businessKey")
    List<RoutePerformance> findRoutePerformance();
}
