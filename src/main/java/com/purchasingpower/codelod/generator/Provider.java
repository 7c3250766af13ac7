package com.purchasingpower.codelod.generator;

import java.util.Arrays;
import java.util.Locale;

/**
 * Description generation backends selectable through {@code codelod.provider}.
 */
public enum Provider {
    MOCK,
    OLLAMA,
    OPENAI,
    ANTHROPIC;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Provider fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Provider value is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(p -> p.name().equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown provider: " + value + " (expected one of mock, ollama, openai, anthropic)"));
    }
}
