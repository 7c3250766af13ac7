package com.purchasingpower.codelod.generator;

import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.core.Scope;
import com.purchasingpower.codelod.core.TestEntities;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Prompt Templates Tests")
class PromptTemplatesTest {

    @Test
    @DisplayName("Function prompt names the entity and embeds its source")
    void forEntity_function() {
        ParsedEntity entity = TestEntities.function("parse_args", "cli.py", "def parse_args(argv):\n    return argv[1:]");

        String prompt = PromptTemplates.forEntity(entity, "Command line entry point");

        assertThat(prompt)
            .contains("description of the following function")
            .contains("Function name: parse_args")
            .contains("Language: python")
            .contains("Context: Command line entry point")
            .endsWith("```\ndef parse_args(argv):\n    return argv[1:]\n```");
    }

    @Test
    @DisplayName("Each scope gets its own prompt")
    void forEntity_scopes() {
        ParsedEntity function = TestEntities.function("Billing", "billing.py", "class Billing: pass");

        assertThat(PromptTemplates.forEntity(function.toBuilder().scope(Scope.CLASS).build(), null))
            .contains("Class name: Billing")
            .doesNotContain("Context:");
        assertThat(PromptTemplates.forEntity(function.toBuilder().scope(Scope.MODULE).build(), " "))
            .contains("Module name: Billing");
        assertThat(PromptTemplates.forEntity(function.toBuilder().scope(Scope.PACKAGE).build(), null))
            .contains("this package named Billing");
    }

    @Test
    @DisplayName("Long sources are truncated with a marker")
    void truncate_longSource() {
        String source = "x".repeat(PromptTemplates.MAX_SOURCE_LENGTH + 10);

        String truncated = PromptTemplates.truncate(source);

        assertThat(truncated).hasSize(PromptTemplates.MAX_SOURCE_LENGTH + PromptTemplates.TRUNCATION_MARKER.length());
        assertThat(truncated).endsWith("... (truncated)");
        assertThat(PromptTemplates.truncate("short")).isEqualTo("short");
        assertThat(PromptTemplates.truncate(null)).isEmpty();
    }
}
