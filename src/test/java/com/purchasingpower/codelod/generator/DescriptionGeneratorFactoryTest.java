package com.purchasingpower.codelod.generator;

import com.purchasingpower.codelod.configuration.CodeLodProperties;
import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.core.Scope;
import com.purchasingpower.codelod.core.TestEntities;
import com.purchasingpower.codelod.generator.impl.MockDescriptionGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Description Generator Factory Tests")
class DescriptionGeneratorFactoryTest {

    @Test
    @DisplayName("The configured provider is used by default")
    void create_usesConfiguredProvider() {
        CodeLodProperties properties = new CodeLodProperties();
        DescriptionGeneratorFactory factory = new DescriptionGeneratorFactory(properties);

        DescriptionGenerator generator = factory.create();

        assertThat(generator).isInstanceOf(MockDescriptionGenerator.class);
        ParsedEntity entity = TestEntities.function("total", "cart.py", "def total(): pass");
        assertThat(generator.generate(entity, null)).isEqualTo("Function total in python.");
        assertThat(generator.generate(entity.toBuilder().scope(Scope.CLASS).name("Cart").build(), null))
            .isEqualTo("Class Cart in python.");
    }

    @Test
    @DisplayName("Hosted providers need an API key")
    void create_requiresApiKey() {
        DescriptionGeneratorFactory factory = new DescriptionGeneratorFactory(new CodeLodProperties());

        assertThatThrownBy(() -> factory.create(Provider.OPENAI))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("OPENAI_API_KEY");
        assertThatThrownBy(() -> factory.create(Provider.ANTHROPIC))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("codelod.anthropic.api-key");
    }

    @Test
    @DisplayName("Ollama needs no credentials and builds its model lazily")
    void create_ollama() {
        DescriptionGenerator generator = new DescriptionGeneratorFactory(new CodeLodProperties()).create(Provider.OLLAMA);

        assertThat(generator.provider()).isEqualTo(Provider.OLLAMA);
    }

    @Test
    @DisplayName("Provider values parse case-insensitively")
    void providerFromValue() {
        assertThat(Provider.fromValue("OpenAI")).isEqualTo(Provider.OPENAI);
        assertThatThrownBy(() -> Provider.fromValue("gemini")).isInstanceOf(IllegalArgumentException.class);
    }
}
