package com.purchasingpower.codelod.sidecar;

import lombok.Builder;
import lombok.Value;

/**
 * Result of seeding the hash index from sidecar files.
 */
@Value
@Builder
public class RecoveryReport {
    int sidecarsRead;
    int fragmentsRead;
    int recordsSeeded;
    int recordsAlreadyPresent;
    int identitiesPointed;
}
