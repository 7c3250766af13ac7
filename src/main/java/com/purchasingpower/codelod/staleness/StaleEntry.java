package com.purchasingpower.codelod.staleness;

import com.purchasingpower.codelod.core.Freshness;
import com.purchasingpower.codelod.core.Scope;
import lombok.Builder;
import lombok.Value;

/**
 * An entity whose description needs attention: either stale or never generated.
 */
@Value
@Builder
public class StaleEntry {
    Scope scope;
    String name;
    String path;
    String currentFingerprint;

    /**
     * Fingerprint of the stored record that made this entry stale; null for unknown entities.
     */
    String storedFingerprint;

    /**
     * Last described fingerprint of the identity, if any. Informational only.
     */
    String previousFingerprint;

    Freshness freshness;

    public boolean isUnknown() {
        return storedFingerprint == null;
    }
}
