package com.purchasingpower.codelod.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for one description record, keyed by fingerprint.
 * Maps to the descriptions table.
 */
@Entity
@Table(name = "descriptions")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DescriptionRecordEntity {

    @Id
    @Column(name = "fingerprint", nullable = false, length = 80)
    private String fingerprint;

    @Lob
    @Column(name = "description", nullable = false)
    private String description;

    @Column(name = "stale", nullable = false)
    private boolean stale;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // JSON array of superseded fingerprints, most recent first
    @Lob
    @Column(name = "fingerprint_history", nullable = false)
    private String fingerprintHistory;
}
