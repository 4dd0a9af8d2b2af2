package com.airline.warehouse.transform;

import com.airline.warehouse.config.LoaderProperties;
import com.airline.warehouse.entity.AircraftDimension;
import com.airline.warehouse.entity.AirportDimension;
import com.airline.warehouse.entity.CustomerDimension;
import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.ingest.AircraftRecord;
import com.airline.warehouse.ingest.AirportRecord;
import com.airline.warehouse.ingest.CustomerRecord;
import com.airline.warehouse.ingest.FlightRecord;
import com.airline.warehouse.ingest.SourceRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Turns validated ingest records into warehouse-ready values.
 *
 * <p>Deterministic: the same input always yields the same output, and
 * {@link #enrich(TransformedFlight)} applied to its own result changes nothing.
 * Only validated records may be passed in.
 */
@Component
@RequiredArgsConstructor
public class RecordTransformer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int COORDINATE_SCALE = 6;

    private final LoaderProperties properties;

    public TransformedRecord transform(SourceRecord record) {
        if (record instanceof FlightRecord) {
            return transformFlight((FlightRecord) record);
        }
        if (record instanceof CustomerRecord) {
            return new DimensionSnapshot(DimensionType.CUSTOMER, toCustomer((CustomerRecord) record));
        }
        if (record instanceof AircraftRecord) {
            return new DimensionSnapshot(DimensionType.AIRCRAFT, toAircraft((AircraftRecord) record));
        }
        if (record instanceof AirportRecord) {
            return new DimensionSnapshot(DimensionType.AIRPORT, toAirport((AirportRecord) record));
        }
        throw new IllegalArgumentException("Cannot transform " + record);
    }

    public TransformedFlight transformFlight(FlightRecord record) {
        TransformedFlight flight = TransformedFlight.builder()
            .flightFactKey(record.getFlightFactKey().trim())
            .flightNumber(record.getFlightNumber().trim())
            .carrierCode(upper(record.getCarrierCode()))
            .flightDate(record.getFlightDate())
            .tailNumber(upper(record.getTailNumber()))
            .departureAirport(upper(record.getDepartureAirport()))
            .arrivalAirport(upper(record.getArrivalAirport()))
            .departureDelayMin(orZero(record.getDepartureDelayMin()))
            .arrivalDelayMin(orZero(record.getArrivalDelayMin()))
            .seatsAvailable(record.getSeatsAvailable())
            .seatsFilled(record.getSeatsFilled())
            .revenue(money(record.getRevenue()))
            .fuelCost(money(record.getFuelCost()))
            .distanceMiles(record.getDistanceMiles())
            .cancelled(Boolean.TRUE.equals(record.getCancelled()))
            .build();
        return enrich(flight);
    }

    /**
     * Recomputes the derived measures from the carried ones.
     */
    public TransformedFlight enrich(TransformedFlight flight) {
        return flight.toBuilder()
            .loadFactor(loadFactor(flight.getSeatsFilled(), flight.getSeatsAvailable()))
            .onTime(flight.getArrivalDelayMin() <= properties.getOnTimeThresholdMinutes())
            .build();
    }

    /**
     * Filled seats as a percentage of available seats, two decimals.
     */
    public static BigDecimal loadFactor(int seatsFilled, int seatsAvailable) {
        if (seatsAvailable <= 0) {
            throw new IllegalArgumentException("seatsAvailable must be positive, was " + seatsAvailable);
        }
        return BigDecimal.valueOf(seatsFilled)
            .multiply(HUNDRED)
            .divide(BigDecimal.valueOf(seatsAvailable), 2, RoundingMode.HALF_UP);
    }

    private CustomerDimension toCustomer(CustomerRecord record) {
        return CustomerDimension.builder()
            .businessKey(record.getCustomerId().trim())
            .firstName(trim(record.getFirstName()))
            .lastName(trim(record.getLastName()))
            .email(trim(record.getEmail()))
            .phone(trim(record.getPhone()))
            .loyaltyTier(trim(record.getLoyaltyTier()))
            .loyaltyPoints(record.getLoyaltyPoints())
            .joinDate(record.getJoinDate())
            .country(trim(record.getCountry()))
            .city(trim(record.getCity()))
            .build();
    }

    private AircraftDimension toAircraft(AircraftRecord record) {
        return AircraftDimension.builder()
            .businessKey(upper(record.getTailNumber()))
            .aircraftType(trim(record.getAircraftType()))
            .manufacturer(trim(record.getManufacturer()))
            .model(trim(record.getModel()))
            .seatingCapacity(record.getSeatingCapacity())
            .cargoCapacityKg(record.getCargoCapacityKg())
            .manufactureYear(record.getManufactureYear())
            .ownershipType(trim(record.getOwnershipType()))
            .maintenanceCycle(trim(record.getMaintenanceCycle()))
            .build();
    }

    private AirportDimension toAirport(AirportRecord record) {
        return AirportDimension.builder()
            .businessKey(upper(record.getIata()))
            .icao(upper(record.getIcao()))
            .airportName(trim(record.getAirportName()))
            .city(trim(record.getCity()))
            .state(trim(record.getState()))
            .country(trim(record.getCountry()))
            .region(trim(record.getRegion()))
            .latitude(coordinate(record.getLatitude()))
            .longitude(coordinate(record.getLongitude()))
            .timezone(trim(record.getTimezone()))
            .build();
    }

    private static String trim(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String upper(String value) {
        String trimmed = trim(value);
        return trimmed == null ? null : trimmed.toUpperCase(Locale.ROOT);
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    private static BigDecimal money(BigDecimal value) {
        return value == null ? null : value.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal coordinate(BigDecimal value) {
        return value == null ? null : value.setScale(COORDINATE_SCALE, RoundingMode.HALF_UP);
    }
}
