package com.airline.warehouse.dimension;

import com.airline.warehouse.config.LoaderProperties;
import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.entity.VersionedDimension;
import com.airline.warehouse.exception.LoaderConfigurationException;
import com.airline.warehouse.repository.VersionedDimensionRepository;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Base handler driven by a table of named attribute accessors. The tracked subset comes
 * from {@link LoaderProperties#getTrackedAttributes()}; naming an attribute the
 * dimension does not have fails startup.
 */
@Slf4j
public abstract class AbstractDimensionHandler<E extends VersionedDimension> implements DimensionHandler<E> {

    private final DimensionType type;
    private final Class<E> rowType;
    private final VersionedDimensionRepository<E> repository;
    private final Map<String, Function<E, Object>> accessors;
    private final List<String> trackedAttributes;

    protected AbstractDimensionHandler(DimensionType type,
                                       Class<E> rowType,
                                       VersionedDimensionRepository<E> repository,
                                       Map<String, Function<E, Object>> accessors,
                                       List<String> defaultTracked,
                                       LoaderProperties properties) {
        this.type = type;
        this.rowType = rowType;
        this.repository = repository;
        this.accessors = accessors;
        this.trackedAttributes = List.copyOf(properties.trackedAttributesFor(type, defaultTracked));

        List<String> unknown = new ArrayList<>();
        for (String name : trackedAttributes) {
            if (!accessors.containsKey(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new LoaderConfigurationException(String.format(
                "Unknown tracked attributes %s for dimension %s; known attributes are %s",
                unknown, type.configName(), accessors.keySet()));
        }
        log.info("Dimension {} tracks {}", type.configName(), trackedAttributes);
    }

    @Override
    public DimensionType type() {
        return type;
    }

    @Override
    public Class<E> rowType() {
        return rowType;
    }

    @Override
    public VersionedDimensionRepository<E> repository() {
        return repository;
    }

    @Override
    public List<String> trackedAttributes() {
        return trackedAttributes;
    }

    @Override
    public List<String> driftedAttributes(E current, E incoming) {
        List<String> drifted = new ArrayList<>();
        for (String name : trackedAttributes) {
            Function<E, Object> accessor = accessors.get(name);
            if (!sameValue(accessor.apply(current), accessor.apply(incoming))) {
                drifted.add(name);
            }
        }
        return drifted;
    }

    @Override
    public E newVersion(E incoming, long surrogateKey, int versionNumber, LocalDateTime effectiveDate) {
        E row = copyOf(incoming);
        row.setSurrogateKey(surrogateKey);
        row.setVersionNumber(versionNumber);
        row.setEffectiveDate(effectiveDate);
        row.setExpirationDate(VersionedDimension.OPEN_END);
        row.setIsCurrent(true);
        return row;
    }

    /**
     * A fresh, unsaved copy of the row's attributes.
     */
    protected abstract E copyOf(E row);

    // exact match; BigDecimal by value so a column's scale does not count as drift
    private static boolean sameValue(Object left, Object right) {
        if (left instanceof BigDecimal && right instanceof BigDecimal) {
            return ((BigDecimal) left).compareTo((BigDecimal) right) == 0;
        }
        return Objects.equals(left, right);
    }
}
