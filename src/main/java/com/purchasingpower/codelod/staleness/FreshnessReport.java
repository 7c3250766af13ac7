package com.purchasingpower.codelod.staleness;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of checking a batch of entities.
 *
 * <p>{@code stale} counts every entity that needs generation, unknown ones included,
 * so {@code total == fresh + stale} and {@code entries.size() == stale}.
 * {@code unknown} is the subset of {@code stale} that has no stored record.
 */
@Value
@Builder
public class FreshnessReport {
    int total;
    int fresh;
    int stale;
    int unknown;

    @Builder.Default
    List<StaleEntry> entries = List.of();

    public boolean hasStale() {
        return stale > 0;
    }

    public static FreshnessReport empty() {
        return FreshnessReport.builder().build();
    }
}
