package com.airline.warehouse.reporting;

import com.airline.warehouse.dimension.DimensionHandlerRegistry;
import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.entity.VersionedDimension;
import com.airline.warehouse.repository.FlightFactRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Read-only views over the warehouse for dashboards and ad-hoc analysis.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class WarehouseReportingService {

    private final DimensionHandlerRegistry handlers;
    private final FlightFactRepository factRepository;

    /**
     * Current version of every entity of a dimension, by business key.
     */
    public List<? extends VersionedDimension> currentRows(DimensionType type) {
        return handlers.handlerFor(type).repository().findAllCurrent();
    }

    public Optional<? extends VersionedDimension> currentRow(DimensionType type, String businessKey) {
        return handlers.handlerFor(type).repository().findCurrentByBusinessKey(businessKey);
    }

    public List<? extends VersionedDimension> history(DimensionType type, String businessKey) {
        return handlers.handlerFor(type).repository().findHistory(businessKey);
    }

    public long currentCount(DimensionType type) {
        return handlers.handlerFor(type).repository().countCurrent();
    }

    public long flightCount() {
        return factRepository.count();
    }

    /**
     * On-time performance per departure/arrival airport pair, cancelled flights excluded.
     */
    public List<RoutePerformance> routePerformance() {
        return factRepository.findRoutePerformance();
    }
}
