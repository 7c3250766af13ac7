package com.purchasingpower.codelod.staleness;

import com.purchasingpower.codelod.core.EntityIdentity;
import com.purchasingpower.codelod.core.Freshness;
import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.index.DescriptionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether stored descriptions are still valid for the current code and
 * records newly generated ones.
 *
 * <p>Classification order for {@link #check}:
 * <ol>
 *   <li>a record for the current fingerprint that is not stale: FRESH</li>
 *   <li>a record for the current fingerprint flagged stale: STALE</li>
 *   <li>the current fingerprint is in the identity's history and its owner is not stale: FRESH (revert)</li>
 *   <li>the identity's current record is flagged stale: STALE</li>
 *   <li>otherwise: UNKNOWN</li>
 * </ol>
 *
 * @since 0.1.0
 */
public interface StalenessTracker {

    /**
     * Read-only classification of one entity.
     */
    Freshness check(EntityIdentity identity, String currentFingerprint);

    /**
     * Classifies every entity, in order. Stops with a
     * {@link java.util.concurrent.CancellationException} if the calling thread is
     * interrupted between entities.
     */
    FreshnessReport checkBatch(List<ParsedEntity> entities);

    /**
     * Persists a freshly generated description and makes it the identity's current one.
     * The identity's previous fingerprint moves to the front of the new record's history,
     * which is capped at the configured limit by dropping the oldest entries.
     *
     * <p>The index may have changed while the description was being generated. This
     * method does not look at the stale flag of {@code fingerprint}: a concurrent
     * {@link #invalidate} can be overwritten. Callers that care re-run {@link #check}
     * immediately before calling.
     */
    void recordGenerated(EntityIdentity identity, String fingerprint, String description);

    /**
     * Explicit invalidation.
     *
     * @return false when the fingerprint has no record
     */
    boolean invalidate(String fingerprint);

    boolean markFresh(String fingerprint);

    /**
     * Looks for {@code currentFingerprint} in the history of the identity's current
     * record. The most recently superseded match wins.
     */
    Optional<RevertMatch> detectRevert(EntityIdentity identity, String currentFingerprint);

    /**
     * Description to reuse for a FRESH entity, from its own record or through a revert.
     */
    Optional<String> resolveDescription(EntityIdentity identity, String currentFingerprint);

    /**
     * Makes an already described fingerprint the identity's current one without
     * generation. A revert found only through history gets its own record, carrying
     * the owning record's description.
     *
     * @throws IllegalStateException when nothing describes the fingerprint
     */
    void adopt(EntityIdentity identity, String fingerprint);

    Optional<DescriptionRecord> description(String fingerprint);

    List<DescriptionRecord> listStale();
}
