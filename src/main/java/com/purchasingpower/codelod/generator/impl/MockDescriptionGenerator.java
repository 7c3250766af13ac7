package com.purchasingpower.codelod.generator.impl;

import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.generator.DescriptionGenerator;
import com.purchasingpower.codelod.generator.Provider;

/**
 * Deterministic placeholder descriptions, no model involved. Used for tests and dry runs.
 */
public class MockDescriptionGenerator implements DescriptionGenerator {

    @Override
    public Provider provider() {
        return Provider.MOCK;
    }

    @Override
    public String generate(ParsedEntity entity, String context) {
        return switch (entity.getScope()) {
            case FUNCTION -> "Function " + entity.getName() + " in " + entity.getLanguage() + ".";
            case CLASS -> "Class " + entity.getName() + " in " + entity.getLanguage() + ".";
            case MODULE -> "Module " + entity.getName() + " written in " + entity.getLanguage() + ".";
            case PACKAGE -> "Package " + entity.getName() + " containing related modules.";
            case PROJECT -> "Project at " + entity.getLocation().path() + ".";
        };
    }
}
