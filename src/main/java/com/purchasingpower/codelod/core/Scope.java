package com.purchasingpower.codelod.core;

import java.util.Arrays;
import java.util.Locale;

/**
 * Hierarchical scope levels for code entities, widest first.
 *
 * Ordering is only used to pick prompt/model configuration and for hierarchical
 * listing. It plays no part in fingerprinting.
 *
 * @since 0.1.0
 */
public enum Scope {
    PROJECT,
    PACKAGE,
    MODULE,
    CLASS,
    FUNCTION;

    /**
     * Lower-case wire value used in sidecar files, identity keys and config.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Scope fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Scope value is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(s -> s.name().equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown scope: " + value));
    }
}
