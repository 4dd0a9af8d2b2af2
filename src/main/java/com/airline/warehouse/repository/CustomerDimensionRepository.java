package com.airline.warehouse.repository;

import com.airline.warehouse.entity.CustomerDimension;
import org.springframework.stereotype.Repository;

/**
 * Repository for customer dimension versions.
 */
@Repository
public interface CustomerDimensionRepository extends VersionedDimensionRepository<CustomerDimension> {
}
