package com.airline.warehouse.dimension;

import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.entity.VersionedDimension;
import com.airline.warehouse.exception.LoaderConfigurationException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the handler of a dimension type.
 */
@Component
public class DimensionHandlerRegistry {

    private final Map<DimensionType, DimensionHandler<?>> handlers = new EnumMap<>(DimensionType.class);

    public DimensionHandlerRegistry(List<DimensionHandler<?>> handlers) {
        for (DimensionHandler<?> handler : handlers) {
            this.handlers.put(handler.type(), handler);
        }
        for (DimensionType type : DimensionType.values()) {
            if (!this.handlers.containsKey(type)) {
                throw new LoaderConfigurationException("No handler registered for dimension " + type.configName());
            }
        }
    }

    @SuppressWarnings("unchecked")
    public <E extends VersionedDimension> DimensionHandler<E> handlerFor(DimensionType type) {
        return (DimensionHandler<E>) handlers.get(type);
    }
}
