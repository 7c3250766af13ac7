package com.purchasingpower.codelod.sidecar;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Parsed sidecar file: free text before the first fragment, then the fragments in file order.
 */
@Value
@Builder
public class SidecarDocument {

    @Builder.Default
    List<String> preamble = List.of();

    @Builder.Default
    List<SidecarFragment> fragments = List.of();

    public static SidecarDocument empty() {
        return SidecarDocument.builder().build();
    }
}
