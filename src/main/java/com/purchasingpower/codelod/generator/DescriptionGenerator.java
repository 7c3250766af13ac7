package com.purchasingpower.codelod.generator;

import com.purchasingpower.codelod.core.ParsedEntity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Produces a natural-language description for a code entity.
 *
 * <p>The returned text is opaque to the rest of the system. Failures are raised as
 * {@link com.purchasingpower.codelod.exception.DescriptionGenerationException};
 * implementations never substitute placeholder text on their own.
 *
 * @since 0.1.0
 */
public interface DescriptionGenerator {

    Provider provider();

    /**
     * @param context optional extra information about the codebase, may be null
     */
    String generate(ParsedEntity entity, String context);

    /**
     * One description per entity, in the same order.
     */
    default List<String> generateBatch(List<ParsedEntity> entities, String context) {
        return entities.stream()
            .map(entity -> generate(entity, context))
            .collect(Collectors.toList());
    }
}
