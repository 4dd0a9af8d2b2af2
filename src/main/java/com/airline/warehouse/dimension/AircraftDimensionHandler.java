package com.airline.warehouse.dimension;

import com.airline.warehouse.config.LoaderProperties;
import com.airline.warehouse.entity.AircraftDimension;
import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.repository.AircraftDimensionRepository;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@Component
public class AircraftDimensionHandler extends AbstractDimensionHandler<AircraftDimension> {

    static final List<String> DEFAULT_TRACKED =
        List.of("aircraftType", "seatingCapacity", "ownershipType", "maintenanceCycle");

    public AircraftDimensionHandler(AircraftDimensionRepository repository, LoaderProperties properties) {
        super(DimensionType.AIRCRAFT, AircraftDimension.class, repository, accessors(), DEFAULT_TRACKED, properties);
    }

    private static Map<String, Function<AircraftDimension, Object>> accessors() {
        Map<String, Function<AircraftDimension, Object>> accessors = new LinkedHashMap<>();
        accessors.put("aircraftType", AircraftDimension::getAircraftType);
        accessors.put("manufacturer", AircraftDimension::getManufacturer);
        accessors.put("model", AircraftDimension::getModel);
        accessors.put("seatingCapacity", AircraftDimension::getSeatingCapacity);
        accessors.put("cargoCapacityKg", AircraftDimension::getCargoCapacityKg);
        accessors.put("manufactureYear", AircraftDimension::getManufactureYear);
        accessors.put("ownershipType", AircraftDimension::getOwnershipType);
        accessors.put("maintenanceCycle", AircraftDimension::getMaintenanceCycle);
        return accessors;
    }

    @Override
    protected AircraftDimension copyOf(AircraftDimension row) {
        return AircraftDimension.builder()
            .businessKey(row.getBusinessKey())
            .aircraftType(row.getAircraftType())
            .manufacturer(row.getManufacturer())
            .model(row.getModel())
            .seatingCapacity(row.getSeatingCapacity())
            .cargoCapacityKg(row.getCargoCapacityKg())
            .manufactureYear(row.getManufactureYear())
            .ownershipType(row.getOwnershipType())
            .maintenanceCycle(row.getMaintenanceCycle())
            .build();
    }
}
