package com.airline.warehouse.repository;

import com.airline.warehouse.entity.AircraftDimension;
import org.springframework.stereotype.Repository;

/**
 * Repository for aircraft dimension versions.
 */
@Repository
public interface AircraftDimensionRepository extends VersionedDimensionRepository<AircraftDimension> {
}
