package com.airline.warehouse.dimension;

import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.entity.VersionedDimension;
import com.airline.warehouse.repository.VersionedDimensionRepository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Everything the SCD2 merger needs to know about one dimension.
 *
 * @param <E> the dimension's row type
 */
public interface DimensionHandler<E extends VersionedDimension> {

    DimensionType type();

    Class<E> rowType();

    VersionedDimensionRepository<E> repository();

    /**
     * Attributes whose change opens a new version, in comparison order.
     */
    List<String> trackedAttributes();

    /**
     * Names of the tracked attributes whose values differ; empty when there is no drift.
     */
    List<String> driftedAttributes(E current, E incoming);

    /**
     * A new current row holding the incoming attributes.
     */
    E newVersion(E incoming, long surrogateKey, int versionNumber, LocalDateTime effectiveDate);
}
