package com.purchasingpower.codelod.core;

import java.util.Objects;

/**
 * Stable identity of a logical code unit. Survives edits; the fingerprint of the
 * unit changes with its content, the identity does not.
 *
 * @since 0.1.0
 */
public record EntityIdentity(Scope scope, String qualifiedName, String filePath) {

    public EntityIdentity {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        Objects.requireNonNull(filePath, "filePath");
    }

    /**
     * Key used to persist the identity's current fingerprint.
     */
    public String key() {
        return scope.value() + "|" + filePath + "|" + qualifiedName;
    }

    @Override
    public String toString() {
        return scope.value() + " " + qualifiedName + " (" + filePath + ")";
    }
}
