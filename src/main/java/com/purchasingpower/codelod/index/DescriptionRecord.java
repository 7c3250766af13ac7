package com.purchasingpower.codelod.index;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Authoritative description of one fingerprint. At most one exists per fingerprint value.
 *
 * @since 0.1.0
 */
@Value
@Builder(toBuilder = true)
public class DescriptionRecord {
    String fingerprint;
    String description;
    boolean stale;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Fingerprints this record superseded for the same identity, most recent first, bounded.
     */
    @Builder.Default
    List<String> fingerprintHistory = List.of();
}
