package com.airline.warehouse.repository;

import com.airline.warehouse.entity.KeySequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for surrogate key sequences.
 */
@Repository
public interface KeySequenceRepository extends JpaRepository<KeySequence, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM KeySequence s WHERE s.sequenceName = :sequenceName")
    Optional<KeySequence> findForUpdate(@Param("sequenceName") String sequenceName);

    /**
     * Plain insert, so that two processes creating the same sequence collide on the
     * primary key instead of one overwriting the other.
     */
    @Modifying
    @Query(value = "INSERT INTO key_sequence (sequence_name, next_value, max_value) "
        + "VALUES (:sequenceName, :nextValue, :maxValue)", nativeQuery = true)
    int insertSequence(
        @Param("sequenceName") String sequenceName,
        @Param("nextValue") long nextValue,
        @Param("maxValue") long maxValue
    );
}
