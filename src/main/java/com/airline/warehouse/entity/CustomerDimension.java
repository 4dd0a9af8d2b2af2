package com.airline.warehouse.entity;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.LocalDate;

/**
 * JPA Entity for the dim_customer table.
 * The business key is the customer id issued by the booking system.
 */
@Entity
@Table(name = "dim_customer",
    uniqueConstraints = @UniqueConstraint(name = "uk_dim_customer_version",
        columnNames = {"customer_id", "version_number"}),
    indexes = {
        @Index(name = "idx_dim_customer_id_current", columnList = "customer_id, is_current")
    })
@AttributeOverride(name = "businessKey", column = @Column(name = "customer_id", nullable = false, length = 50))
@Getter
@Setter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = false)
@SuperBuilder
@NoArgsConstructor
public class CustomerDimension extends VersionedDimension {

    @Column(name = "first_name", length = 50)
    private String firstName;

    @Column(name = "last_name", length = 50)
    private String lastName;

    @Column(length = 100)
    private String email;

    @Column(length = 20)
    private String phone;

    @Column(name = "loyalty_tier", length = 20)
    private String loyaltyTier;

    @Column(name = "loyalty_points")
    private Integer loyaltyPoints;

    @Column(name = "join_date")
    private LocalDate joinDate;

    @Column(length = 50)
    private String country;

    @Column(length = 50)
    private String city;
}
