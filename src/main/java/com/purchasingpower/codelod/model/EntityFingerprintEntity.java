package com.purchasingpower.codelod.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Current described fingerprint of an entity identity.
 * Lets a new record inherit the fingerprint it supersedes.
 */
@Entity
@Table(name = "entity_fingerprints")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EntityFingerprintEntity {

    @Id
    @Column(name = "identity_key", nullable = false, length = 2048)
    private String identityKey;

    @Column(name = "scope", nullable = false, length = 20)
    private String scope;

    @Column(name = "qualified_name", nullable = false, length = 1024)
    private String qualifiedName;

    @Column(name = "file_path", nullable = false, length = 1024)
    private String filePath;

    @Column(name = "fingerprint", nullable = false, length = 80)
    private String fingerprint;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
