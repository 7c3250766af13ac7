package com.purchasingpower.codelod.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.purchasingpower.codelod.cli.CommandArguments;
import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.cli.ExitCodes;
import com.purchasingpower.codelod.cli.LodCommand;
import com.purchasingpower.codelod.configuration.ApiProviderProperties;
import com.purchasingpower.codelod.configuration.CodeLodProperties;
import com.purchasingpower.codelod.configuration.ModelConfig;
import com.purchasingpower.codelod.core.CodeLodPaths;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prints the effective configuration. API keys are masked.
 */
@Component
@RequiredArgsConstructor
public class ConfigCommand implements LodCommand {

    private final CodeLodProperties properties;
    private final CodeLodPaths paths;
    private final YAMLMapper yamlMapper;
    private final CommandOutput output;

    @Override
    public String getName() {
        return "config";
    }

    @Override
    public String getDescription() {
        return "Show the effective configuration";
    }

    @Override
    public int execute(CommandArguments args) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("root-dir", paths.rootDir().toString());
        settings.put("config-file", paths.configFile().toString());
        settings.put("provider", properties.getProvider().value());
        settings.put("languages", properties.getLanguages());
        settings.put("max-parallelism", properties.getMaxParallelism());
        settings.put("history-limit", properties.getHistoryLimit());
        settings.put("fail-on-stale", properties.isFailOnStale());
        settings.put("auto-update", properties.isAutoUpdate());

        Map<String, Object> models = new LinkedHashMap<>();
        for (Map.Entry<String, ModelConfig> entry : properties.getModels().entrySet()) {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("default-model", entry.getValue().getDefaultModel());
            Map<String, String> scopes = new LinkedHashMap<>();
            entry.getValue().getScopes().forEach((scope, name) -> scopes.put(scope.value(), name));
            model.put("scopes", scopes);
            models.put(entry.getKey(), model);
        }
        settings.put("models", models);

        Map<String, Object> ollama = new LinkedHashMap<>();
        ollama.put("base-url", properties.getOllama().getBaseUrl());
        ollama.put("default-model", properties.getOllama().getDefaultModel());
        settings.put("ollama", ollama);
        settings.put("openai", hostedProvider(properties.getOpenai()));
        settings.put("anthropic", hostedProvider(properties.getAnthropic()));

        try {
            output.println(yamlMapper.writeValueAsString(Map.of("codelod", settings)).stripTrailing());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render configuration", e);
        }
        return ExitCodes.OK;
    }

    private static Map<String, Object> hostedProvider(ApiProviderProperties provider) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("api-key", provider.getApiKey() == null || provider.getApiKey().isBlank() ? "(not set)" : "****");
        values.put("default-model", provider.getDefaultModel());
        return values;
    }
}
