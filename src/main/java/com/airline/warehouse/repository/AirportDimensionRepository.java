package com.airline.warehouse.repository;

import com.airline.warehouse.entity.AirportDimension;
import org.springframework.stereotype.Repository;

/**
 * Repository for airport dimension versions.
 */
@Repository
public interface AirportDimensionRepository extends VersionedDimensionRepository<AirportDimension> {
}
