package com.purchasingpower.codelod.index;

import com.purchasingpower.codelod.core.EntityIdentity;

import java.util.List;
import java.util.Optional;

/**
 * Durable mapping from fingerprint to {@link DescriptionRecord}, plus the current
 * fingerprint of each entity identity.
 *
 * <p>Every mutation is atomic per key and committed before the call returns; a
 * successful return can be treated as crash-safe. Storage failures surface as
 * {@link com.purchasingpower.codelod.exception.HashIndexException}. A stored record
 * whose history cannot be decoded reads as absent.
 *
 * @since 0.1.0
 */
public interface HashIndex {

    Optional<DescriptionRecord> get(String fingerprint);

    /**
     * Inserts or fully replaces the record for {@code fingerprint}. {@code created_at}
     * survives a replace, {@code updated_at} is refreshed.
     */
    void set(String fingerprint, String description, boolean stale, List<String> history);

    default void set(String fingerprint, String description) {
        set(fingerprint, description, false, List.of());
    }

    /**
     * Writes the record and points {@code identity} at it in a single transaction.
     */
    void record(EntityIdentity identity, String fingerprint, String description, boolean stale, List<String> history);

    default void record(EntityIdentity identity, String fingerprint, String description, List<String> history) {
        record(identity, fingerprint, description, false, history);
    }

    /**
     * @return false when no record exists for the fingerprint
     */
    boolean markStale(String fingerprint);

    /**
     * @return false when no record exists for the fingerprint
     */
    boolean markFresh(String fingerprint);

    List<DescriptionRecord> listStale();

    List<DescriptionRecord> listAll();

    long count();

    /**
     * Removes a record. Only used by destructive resets.
     */
    void delete(String fingerprint);

    /**
     * Whole-store reset: all records and identity pointers.
     */
    void clear();

    Optional<String> currentFingerprint(EntityIdentity identity);

    void point(EntityIdentity identity, String fingerprint);
}
