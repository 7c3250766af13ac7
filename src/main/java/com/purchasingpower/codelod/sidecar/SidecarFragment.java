package com.purchasingpower.codelod.sidecar;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One annotated entity in a sidecar file.
 *
 * @since 0.1.0
 */
@Value
@Builder(toBuilder = true)
public class SidecarFragment {
    String fingerprint;
    boolean stale;
    String description;

    /** Literal declaration line of the entity, for human cross-reference. May be null. */
    String signature;

    /** 1-based line range of the fragment in the sidecar file. */
    int startLine;
    int endLine;

    /** Free text that follows the fragment and travels with its entity on rewrite. */
    @Builder.Default
    List<String> trailingLines = List.of();
}
