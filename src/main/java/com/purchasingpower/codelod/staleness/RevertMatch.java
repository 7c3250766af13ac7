package com.purchasingpower.codelod.staleness;

import lombok.Builder;
import lombok.Value;

/**
 * Current content matches a fingerprint the identity has had before.
 */
@Value
@Builder
public class RevertMatch {
    String fingerprint;

    /** Record whose history contains {@link #fingerprint}. */
    String ownerFingerprint;

    String description;

    /** Position in the owner's history; 0 is the most recently superseded. */
    int historyPosition;
}
