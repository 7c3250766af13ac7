package com.purchasingpower.codelod.generator;

import com.purchasingpower.codelod.configuration.ApiProviderProperties;
import com.purchasingpower.codelod.configuration.CodeLodProperties;
import com.purchasingpower.codelod.configuration.OllamaProperties;
import com.purchasingpower.codelod.generator.impl.ChatModelDescriptionGenerator;
import com.purchasingpower.codelod.generator.impl.MockDescriptionGenerator;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Registry of generator constructors, one per {@link Provider}.
 *
 * <p>Generators are built on demand so that an unused provider never needs credentials.
 */
@Slf4j
@Component
public class DescriptionGeneratorFactory {

    static final String OPENAI_DEFAULT_MODEL = "gpt-4o";
    static final String ANTHROPIC_DEFAULT_MODEL = "claude-sonnet-4-5-20250929";

    private final CodeLodProperties properties;
    private final Map<Provider, Supplier<DescriptionGenerator>> constructors = new EnumMap<>(Provider.class);

    public DescriptionGeneratorFactory(CodeLodProperties properties) {
        this.properties = properties;
        constructors.put(Provider.MOCK, MockDescriptionGenerator::new);
        constructors.put(Provider.OLLAMA, this::ollama);
        constructors.put(Provider.OPENAI, this::openAi);
        constructors.put(Provider.ANTHROPIC, this::anthropic);
    }

    /**
     * Generator for the configured {@code codelod.provider}.
     */
    public DescriptionGenerator create() {
        return create(properties.getProvider());
    }

    public DescriptionGenerator create(Provider provider) {
        Supplier<DescriptionGenerator> constructor = constructors.get(provider);
        if (constructor == null) {
            throw new IllegalArgumentException("No generator registered for provider " + provider);
        }
        log.info("🚀 Description provider: {}", provider.value());
        return constructor.get();
    }

    private DescriptionGenerator ollama() {
        OllamaProperties ollama = properties.getOllama();
        return new ChatModelDescriptionGenerator(Provider.OLLAMA, properties.modelsFor(Provider.OLLAMA),
            ollama.getDefaultModel(),
            modelName -> OllamaChatModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(modelName)
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .temperature(0.0)
                .maxRetries(ollama.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build());
    }

    private DescriptionGenerator openAi() {
        ApiProviderProperties openai = properties.getOpenai();
        String apiKey = requireApiKey(openai, "openai", "OPENAI_API_KEY");
        return new ChatModelDescriptionGenerator(Provider.OPENAI, properties.modelsFor(Provider.OPENAI),
            defaultModel(openai, OPENAI_DEFAULT_MODEL),
            modelName -> OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .timeout(Duration.ofSeconds(openai.getTimeoutSeconds()))
                .maxRetries(openai.getMaxRetries())
                .temperature(0.0)
                .build());
    }

    private DescriptionGenerator anthropic() {
        ApiProviderProperties anthropic = properties.getAnthropic();
        String apiKey = requireApiKey(anthropic, "anthropic", "ANTHROPIC_API_KEY");
        return new ChatModelDescriptionGenerator(Provider.ANTHROPIC, properties.modelsFor(Provider.ANTHROPIC),
            defaultModel(anthropic, ANTHROPIC_DEFAULT_MODEL),
            modelName -> AnthropicChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .timeout(Duration.ofSeconds(anthropic.getTimeoutSeconds()))
                .maxRetries(anthropic.getMaxRetries())
                .maxTokens(1024)
                .temperature(0.0)
                .build());
    }

    private static String requireApiKey(ApiProviderProperties provider, String name, String envVariable) {
        if (provider.getApiKey() == null || provider.getApiKey().isBlank()) {
            throw new IllegalStateException("No API key for " + name
                + ": set codelod." + name + ".api-key or " + envVariable);
        }
        return provider.getApiKey();
    }

    private static String defaultModel(ApiProviderProperties provider, String builtIn) {
        return provider.getDefaultModel() == null || provider.getDefaultModel().isBlank()
            ? builtIn
            : provider.getDefaultModel();
    }
}
