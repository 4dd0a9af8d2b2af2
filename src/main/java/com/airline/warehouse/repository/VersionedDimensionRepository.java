package com.airline.warehouse.repository;

import com.airline.warehouse.entity.VersionedDimension;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Shared queries of the SCD2 dimension repositories.
 * Provides database access methods with support for versioning.
 */
@NoRepositoryBean
public interface VersionedDimensionRepository<E extends VersionedDimension> extends JpaRepository<E, Long> {

    /**
     * Find the current version of an entity by business key
     */
    @Query("SELECT d FROM #{#entityName} d WHERE d.businessKey = :businessKey AND d.isCurrent = true")
    Optional<E> findCurrentByBusinessKey(@Param("businessKey") String businessKey);

    /**
     * Find a specific version of an entity
     */
    @Query("SELECT d FROM #{#entityName} d WHERE d.businessKey = :businessKey AND d.versionNumber = :version")
    Optional<E> findByBusinessKeyAndVersion(
        @Param("businessKey") String businessKey,
        @Param("version") Integer version
    );

    /**
     * All versions whose validity window contains the instant, newest first
     */
    @Query("SELECT d FROM #{#entityName} d WHERE d.businessKey = :businessKey "
        + "AND d.effectiveDate <= :instant AND d.expirationDate > :instant ORDER BY d.versionNumber DESC")
    List<E> findVersionsCovering(
        @Param("businessKey") String businessKey,
        @Param("instant") LocalDateTime instant
    );

    default Optional<E> findVersionAsOf(String businessKey, LocalDateTime instant) {
        return findVersionsCovering(businessKey, instant).stream().findFirst();
    }

    /**
     * Full version chain of an entity, oldest first
     */
    @Query("SELECT d FROM #{#entityName} d WHERE d.businessKey = :businessKey ORDER BY d.versionNumber")
    List<E> findHistory(@Param("businessKey") String businessKey);

    /**
     * Expire a version if it is still current. Returns 0 when another writer got there first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE #{#entityName} d SET d.isCurrent = false, d.expirationDate = :asOf "
        + "WHERE d.surrogateKey = :surrogateKey AND d.isCurrent = true")
    int expireVersion(@Param("surrogateKey") Long surrogateKey, @Param("asOf") LocalDateTime asOf);

    /**
     * Get the latest version number for a business key
     */
    @Query("SELECT MAX(d.versionNumber) FROM #{#entityName} d WHERE d.businessKey = :businessKey")
    Optional<Integer> getLatestVersion(@Param("businessKey") String businessKey);

    @Query("SELECT d FROM #{#entityName} d WHERE d.isCurrent = true ORDER BY d.businessKey")
    List<E> findAllCurrent();

    /**
     * Count current rows
     */
    @Query("SELECT COUNT(d) FROM #{#entityName} d WHERE d.isCurrent = true")
    long countCurrent();

    @Query("SELECT d.businessKey FROM #{#entityName} d WHERE d.isCurrent = true "
        + "GROUP BY d.businessKey HAVING COUNT(d) > 1")
    List<String> findBusinessKeysWithMultipleCurrentVersions();

    /**
     * Rows whose window is inconsistent: expired before they took effect, or current
     * without the open-ended expiration.
     */
    @Query("SELECT COUNT(d) FROM #{#entityName} d WHERE "
        + "(d.isCurrent = false AND d.expirationDate < d.effectiveDate) "
        + "OR (d.isCurrent = true AND d.expirationDate <> :openEnd)")
    long countInvalidVersionWindows(@Param("openEnd") LocalDateTime openEnd);
}
