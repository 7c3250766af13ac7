package com.purchasingpower.codelod.generator.impl;

import com.purchasingpower.codelod.configuration.ModelConfig;
import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.exception.DescriptionGenerationException;
import com.purchasingpower.codelod.generator.DescriptionGenerator;
import com.purchasingpower.codelod.generator.PromptTemplates;
import com.purchasingpower.codelod.generator.Provider;
import dev.langchain4j.model.chat.ChatLanguageModel;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Description generator backed by a langchain4j {@link ChatLanguageModel}.
 *
 * <p>The model is chosen per scope from the provider's {@link ModelConfig}; each distinct
 * model name is built once and shared between worker threads.
 */
@Slf4j
public class ChatModelDescriptionGenerator implements DescriptionGenerator {

    private final Provider provider;
    private final ModelConfig models;
    private final String fallbackModel;
    private final Function<String, ChatLanguageModel> modelFactory;
    private final Map<String, ChatLanguageModel> cache = new ConcurrentHashMap<>();

    public ChatModelDescriptionGenerator(Provider provider,
                                         ModelConfig models,
                                         String fallbackModel,
                                         Function<String, ChatLanguageModel> modelFactory) {
        this.provider = provider;
        this.models = models;
        this.fallbackModel = fallbackModel;
        this.modelFactory = modelFactory;
    }

    @Override
    public Provider provider() {
        return provider;
    }

    @Override
    public String generate(ParsedEntity entity, String context) {
        String modelName = modelFor(entity);
        try {
            ChatLanguageModel model = cache.computeIfAbsent(modelName, name -> {
                log.info("🤖 Initializing {} model: {}", provider.value(), name);
                return modelFactory.apply(name);
            });
            String response = model.generate(PromptTemplates.forEntity(entity, context));
            if (response == null || response.isBlank()) {
                throw new DescriptionGenerationException(entity.getName(),
                    provider.value() + " returned an empty description", null);
            }
            return response.strip();
        } catch (DescriptionGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("❌ {} generation failed for {} ({}): {}",
                provider.value(), entity.getName(), modelName, e.getMessage());
            throw new DescriptionGenerationException(entity.getName(),
                provider.value() + " generation failed: " + e.getMessage(), e);
        }
    }

    String modelFor(ParsedEntity entity) {
        String configured = models.getModelForScope(entity.getScope());
        return configured != null && !configured.isBlank() ? configured : fallbackModel;
    }
}
