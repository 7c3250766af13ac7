package com.purchasingpower.codelod.configuration;

import com.purchasingpower.codelod.core.Scope;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

/**
 * Model names for one provider: a default plus optional per-scope overrides.
 *
 * <pre>
 * codelod:
 *   models:
 *     openai:
 *       default-model: gpt-4o
 *       scopes:
 *         function: gpt-4o-mini
 * </pre>
 */
@Data
public class ModelConfig {

    private String defaultModel;

    private Map<Scope, String> scopes = new EnumMap<>(Scope.class);

    /**
     * Scope-specific model, falling back to the default. Null when neither is configured.
     */
    public String getModelForScope(Scope scope) {
        String scoped = scopes.get(scope);
        if (scoped != null && !scoped.isBlank()) {
            return scoped;
        }
        return defaultModel;
    }
}
