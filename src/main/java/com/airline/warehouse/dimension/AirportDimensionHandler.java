package com.airline.warehouse.dimension;

import com.airline.warehouse.config.LoaderProperties;
import com.airline.warehouse.entity.AirportDimension;
import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.repository.AirportDimensionRepository;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@Component
public class AirportDimensionHandler extends AbstractDimensionHandler<AirportDimension> {

    static final List<String> DEFAULT_TRACKED = List.of("airportName", "city", "region", "timezone");

    public AirportDimensionHandler(AirportDimensionRepository repository, LoaderProperties properties) {
        super(DimensionType.AIRPORT, AirportDimension.class, repository, accessors(), DEFAULT_TRACKED, properties);
    }

    private static Map<String, Function<AirportDimension, Object>> accessors() {
        Map<String, Function<AirportDimension, Object>> accessors = new LinkedHashMap<>();
        accessors.put("icao", AirportDimension::getIcao);
        accessors.put("airportName", AirportDimension::getAirportName);
        accessors.put("city", AirportDimension::getCity);
        accessors.put("state", AirportDimension::getState);
        accessors.put("country", AirportDimension::getCountry);
        accessors.put("region", AirportDimension::getRegion);
        accessors.put("latitude", AirportDimension::getLatitude);
        accessors.put("longitude", AirportDimension::getLongitude);
        accessors.put("timezone", AirportDimension::getTimezone);
        return accessors;
    }

    @Override
    protected AirportDimension copyOf(AirportDimension row) {
        return AirportDimension.builder()
            .businessKey(row.getBusinessKey())
            .icao(row.getIcao())
            .airportName(row.getAirportName())
            .city(row.getCity())
            .state(row.getState())
            .country(row.getCountry())
            .region(row.getRegion())
            .latitude(row.getLatitude())
            .longitude(row.getLongitude())
            .timezone(row.getTimezone())
            .build();
    }
}
