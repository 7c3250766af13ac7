package com.purchasingpower.codelod.pipeline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one generation run.
 *
 * @since 0.1.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationReport {

    private int filesScanned;
    private int entitiesDiscovered;

    /** Entities whose description was already current. */
    private int alreadyFresh;

    /** Entities brought up to date without calling the generator (reverts, shared fingerprints). */
    private int reused;

    private int generated;
    private int failed;
    private int sidecarsWritten;
    private boolean interrupted;
    private long durationMs;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean isSuccess() {
        return failed == 0 && !interrupted && errors.isEmpty();
    }

    public static GenerationReport empty() {
        return GenerationReport.builder().build();
    }
}
