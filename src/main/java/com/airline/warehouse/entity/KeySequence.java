package com.airline.warehouse.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for the key_sequence table: one row per dimension, holding the next
 * surrogate key to hand out.
 */
@Entity
@Table(name = "key_sequence")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeySequence {

    @Id
    @Column(name = "sequence_name", length = 50)
    private String sequenceName;

    @Column(name = "next_value", nullable = false)
    private Long nextValue;

    @Column(name = "max_value", nullable = false)
    private Long maxValue;
}
