package com.airline.warehouse.entity;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;

/**
 * JPA Entity for the dim_airport table, keyed by IATA code.
 */
@Entity
@Table(name = "dim_airport",
    uniqueConstraints = @UniqueConstraint(name = "uk_dim_airport_version",
        columnNames = {"iata", "version_number"}),
    indexes = {
        @Index(name = "idx_dim_airport_iata_current", columnList = "iata, is_current")
    })
@AttributeOverride(name = "businessKey", column = @Column(name = "iata", nullable = false, length = 3))
@Getter
@Setter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = false)
@SuperBuilder
@NoArgsConstructor
public class AirportDimension extends VersionedDimension {

    @Column(length = 4)
    private String icao;

    @Column(name = "airport_name", length = 100)
    private String airportName;

    @Column(length = 50)
    private String city;

    @Column(length = 50)
    private String state;

    @Column(length = 50)
    private String country;

    @Column(length = 50)
    private String region;

    @Column(precision = 9, scale = 6)
    private BigDecimal latitude;

    @Column(precision = 9, scale = 6)
    private BigDecimal longitude;

    @Column(length = 50)
    private String timezone;
}
