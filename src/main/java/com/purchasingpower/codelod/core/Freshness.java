package com.purchasingpower.codelod.core;

/**
 * Freshness classification of an entity's stored description. Derived, never stored.
 *
 * @since 0.1.0
 */
public enum Freshness {
    /** A usable description exists for the current fingerprint (directly or by revert). */
    FRESH,
    /** A description exists but has been flagged stale. */
    STALE,
    /** Nothing usable is known; a new description has to be generated. */
    UNKNOWN;

    public boolean needsGeneration() {
        return this != FRESH;
    }
}
