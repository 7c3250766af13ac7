package com.purchasingpower.codelod.pipeline;

import com.purchasingpower.codelod.core.Scope;
import com.purchasingpower.codelod.generator.DescriptionGenerator;

import java.nio.file.Path;
import java.util.List;

/**
 * Brings descriptions of the given files up to date.
 *
 * <p>Each entity is classified; fresh and reverted entities reuse what is stored, the
 * rest go to the generator on a bounded worker pool. Every result is committed on its
 * own as soon as it arrives, and each file's sidecar is reconciled once all its
 * entities are settled. A failed generation is reported and does not stop the others.
 *
 * @since 0.1.0
 */
public interface DescriptionPipeline {

    /**
     * Uses the generator of the configured provider.
     */
    GenerationReport generate(List<Path> files, boolean force);

    /**
     * @param force invalidate every entity's current description before classifying
     * @param scope only entities of this scope, or all when null
     */
    GenerationReport generate(List<Path> files, boolean force, Scope scope, DescriptionGenerator generator);
}
