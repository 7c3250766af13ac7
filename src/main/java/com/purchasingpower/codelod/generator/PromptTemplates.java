package com.purchasingpower.codelod.generator;

import com.purchasingpower.codelod.core.ParsedEntity;

/**
 * Prompts sent to chat models, one per scope.
 */
public final class PromptTemplates {

    public static final int MAX_SOURCE_LENGTH = 8192;
    static final String TRUNCATION_MARKER = "\n... (truncated)";

    private static final String FUNCTION_PROMPT = """
        You are a code documentation expert. Generate a clear, concise description of the following function.

        Function name: %s
        Language: %s

        Provide a 1-2 sentence description of what this function does, its inputs, and its output.""";

    private static final String CLASS_PROMPT = """
        You are a code documentation expert. Generate a clear, concise description of the following class.

        Class name: %s
        Language: %s

        Provide a 1-2 sentence description of this class's purpose and key functionality.""";

    private static final String MODULE_PROMPT = """
        You are a code documentation expert. Generate a clear, concise description of the following module.

        Module name: %s
        Language: %s

        Provide a 2-3 sentence overview of this module's purpose and main exports.""";

    private PromptTemplates() {
    }

    /**
     * Full user message: scope prompt, optional context, then the (possibly truncated) source.
     */
    public static String forEntity(ParsedEntity entity, String context) {
        String prompt = switch (entity.getScope()) {
            case FUNCTION -> String.format(FUNCTION_PROMPT, entity.getName(), entity.getLanguage());
            case CLASS -> String.format(CLASS_PROMPT, entity.getName(), entity.getLanguage());
            case MODULE -> String.format(MODULE_PROMPT, entity.getName(), entity.getLanguage());
            default -> String.format("Generate a concise 1-2 sentence description for this %s named %s in %s.",
                entity.getScope().value(), entity.getName(), entity.getLanguage());
        };
        if (context != null && !context.isBlank()) {
            prompt += "\n\nContext: " + context;
        }
        return prompt + "\n\nSource code:\n```\n" + truncate(entity.getSource()) + "\n```";
    }

    public static String truncate(String source) {
        if (source == null) {
            return "";
        }
        if (source.length() > MAX_SOURCE_LENGTH) {
            return source.substring(0, MAX_SOURCE_LENGTH) + TRUNCATION_MARKER;
        }
        return source;
    }
}
