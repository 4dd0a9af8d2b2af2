package com.airline.warehouse.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * Common columns of every SCD Type 2 dimension table.
 *
 * <p>Each row is one version of a business entity. The surrogate key is assigned by
 * {@link com.airline.warehouse.dimension.SurrogateKeyAllocator} before insert, so the
 * entity reports itself as new until it has been persisted or loaded. That keeps
 * {@code save()} on an already used key from silently turning into an update.
 */
@MappedSuperclass
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public abstract class VersionedDimension implements Persistable<Long> {

    /**
     * Expiration date of the current version.
     */
    public static final LocalDateTime OPEN_END = LocalDateTime.of(9999, 12, 31, 0, 0);

    @Id
    @Column(name = "surrogate_key")
    private Long surrogateKey;

    @Column(name = "business_key", nullable = false, length = 50)
    private String businessKey;

    @Column(name = "version_number", nullable = false)
    @Builder.Default
    private Integer versionNumber = 1;

    @Column(name = "effective_date", nullable = false)
    private LocalDateTime effectiveDate;

    @Column(name = "expiration_date", nullable = false)
    @Builder.Default
    private LocalDateTime expirationDate = OPEN_END;

    @Column(name = "is_current", nullable = false)
    @Builder.Default
    private Boolean isCurrent = true;

    @Transient
    @Builder.Default
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean newRow = true;

    @Override
    public Long getId() {
        return surrogateKey;
    }

    @Override
    public boolean isNew() {
        return newRow;
    }

    /**
     * True when this version covers the given instant.
     */
    public boolean covers(LocalDateTime instant) {
        return !effectiveDate.isAfter(instant) && expirationDate.isAfter(instant);
    }

    @PostLoad
    @PostPersist
    protected void markPersisted() {
        newRow = false;
    }
}
