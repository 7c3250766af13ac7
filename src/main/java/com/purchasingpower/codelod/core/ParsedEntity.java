package com.purchasingpower.codelod.core;

import lombok.Builder;
import lombok.Value;

/**
 * A code entity as delivered by a {@code CodeParser}, already fingerprinted.
 *
 * @since 0.1.0
 */
@Value
@Builder(toBuilder = true)
public class ParsedEntity {
    Scope scope;
    String name;          // qualified within the file, e.g. "PaymentService.refund"
    String parentName;    // enclosing type, null for top-level entities
    CodeLocation location;
    String source;
    String fingerprint;
    String language;

    public EntityIdentity identity() {
        return new EntityIdentity(scope, name, location.path());
    }
}
