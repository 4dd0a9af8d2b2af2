package com.airline.warehouse.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * JPA Entity for the fact_flight table.
 *
 * <p>One row per flight leg, keyed by the business-unique flight fact key. Dimension
 * references hold the surrogate keys of the versions valid on the flight date. Only
 * the delay, seats filled, load factor and on-time columns are revised by later loads.
 */
@Entity
@Table(name = "fact_flight", indexes = {
    @Index(name = "idx_fact_flight_date", columnList = "flight_date"),
    @Index(name = "idx_fact_flight_aircraft", columnList = "aircraft_key"),
    @Index(name = "idx_fact_flight_route", columnList = "departure_airport_key, arrival_airport_key")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlightFact implements Persistable<String> {

    @Id
    @Column(name = "flight_fact_key", length = 40)
    private String flightFactKey;

    @Column(name = "flight_number", nullable = false, length = 20)
    private String flightNumber;

    @Column(name = "carrier_code", length = 10)
    private String carrierCode;

    @Column(name = "flight_date", nullable = false)
    private LocalDate flightDate;

    @Column(name = "aircraft_key", nullable = false)
    private Long aircraftKey;

    @Column(name = "departure_airport_key", nullable = false)
    private Long departureAirportKey;

    @Column(name = "arrival_airport_key", nullable = false)
    private Long arrivalAirportKey;

    @Column(name = "departure_delay_min")
    @Builder.Default
    private Integer departureDelayMin = 0;

    @Column(name = "arrival_delay_min")
    @Builder.Default
    private Integer arrivalDelayMin = 0;

    @Column(name = "seats_available", nullable = false)
    private Integer seatsAvailable;

    @Column(name = "seats_filled", nullable = false)
    private Integer seatsFilled;

    @Column(name = "load_factor", precision = 5, scale = 2)
    private BigDecimal loadFactor;

    @Column(name = "on_time_flag")
    private Boolean onTimeFlag;

    @Column(precision = 12, scale = 2)
    private BigDecimal revenue;

    @Column(name = "fuel_cost", precision = 10, scale = 2)
    private BigDecimal fuelCost;

    @Column(name = "distance_miles")
    private Integer distanceMiles;

    @Column(name = "cancellation_flag")
    @Builder.Default
    private Boolean cancellationFlag = false;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Transient
    @Builder.Default
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private boolean newRow = true;

    @Override
    public String getId() {
        return flightFactKey;
    }

    @Override
    public boolean isNew() {
        return newRow;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    @PostLoad
    @PostPersist
    protected void markPersisted() {
        newRow = false;
    }
}
