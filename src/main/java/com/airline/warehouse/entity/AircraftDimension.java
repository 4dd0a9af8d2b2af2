package com.airline.warehouse.entity;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * JPA Entity for the dim_aircraft table, keyed by tail number.
 */
@Entity
@Table(name = "dim_aircraft",
    uniqueConstraints = @UniqueConstraint(name = "uk_dim_aircraft_version",
        columnNames = {"tail_number", "version_number"}),
    indexes = {
        @Index(name = "idx_dim_aircraft_tail_current", columnList = "tail_number, is_current")
    })
@AttributeOverride(name = "businessKey", column = @Column(name = "tail_number", nullable = false, length = 20))
@Getter
@Setter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = false)
@SuperBuilder
@NoArgsConstructor
public class AircraftDimension extends VersionedDimension {

    @Column(name = "aircraft_type", length = 50)
    private String aircraftType;

    @Column(length = 50)
    private String manufacturer;

    @Column(length = 50)
    private String model;

    @Column(name = "seating_capacity")
    private Integer seatingCapacity;

    @Column(name = "cargo_capacity_kg")
    private Integer cargoCapacityKg;

    @Column(name = "manufacture_year")
    private Integer manufactureYear;

    @Column(name = "ownership_type", length = 20)
    private String ownershipType;

    @Column(name = "maintenance_cycle", length = 20)
    private String maintenanceCycle;
}
