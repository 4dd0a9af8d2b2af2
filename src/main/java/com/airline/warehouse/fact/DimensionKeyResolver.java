package com.airline.warehouse.fact;

import com.airline.warehouse.dimension.DimensionHandlerRegistry;
import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.entity.VersionedDimension;
import com.airline.warehouse.exception.UnresolvedReferenceException;
import com.airline.warehouse.repository.VersionedDimensionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Maps the business keys a flight refers to onto the surrogate keys of the dimension
 * versions that were valid on the flight date.
 *
 * <p>A flight dated before the first version of an entity resolves to the current
 * version, since the warehouse has nothing older to offer.
 */
@Component
@RequiredArgsConstructor
public class DimensionKeyResolver {

    private final DimensionHandlerRegistry handlers;

    public long resolve(String factKey, DimensionType type, String businessKey, LocalDate flightDate) {
        VersionedDimensionRepository<VersionedDimension> repository = handlers.handlerFor(type).repository();
        LocalDateTime instant = flightDate.atStartOfDay();
        return repository.findVersionAsOf(businessKey, instant)
            .or(() -> repository.findCurrentByBusinessKey(businessKey))
            .map(VersionedDimension::getSurrogateKey)
            .orElseThrow(() -> new UnresolvedReferenceException(factKey, type, businessKey));
    }
}
