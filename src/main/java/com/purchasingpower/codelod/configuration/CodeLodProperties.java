package com.purchasingpower.codelod.configuration;

import com.purchasingpower.codelod.generator.Provider;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "codelod")
public class CodeLodProperties {

    @NotBlank(message = "Project root directory is required")
    private String rootDir = ".";

    /**
     * Maximum number of superseded fingerprints kept per record. Oldest are evicted first.
     */
    @Min(1)
    @Max(1000)
    private int historyLimit = 10;

    @Min(1)
    @Max(64)
    private int maxParallelism = 8;

    @NotNull
    private Provider provider = Provider.MOCK;

    @NotEmpty
    private List<String> languages = new ArrayList<>(List.of("java"));

    private boolean failOnStale = false;

    private boolean autoUpdate = false;

    /**
     * Model selection per provider, keyed by provider value ("openai", "ollama", ...).
     */
    @Valid
    @NotNull
    private Map<String, ModelConfig> models = new LinkedHashMap<>();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OllamaProperties ollama = new OllamaProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ApiProviderProperties openai = new ApiProviderProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ApiProviderProperties anthropic = new ApiProviderProperties();

    public ModelConfig modelsFor(Provider provider) {
        return models.getOrDefault(provider.value(), new ModelConfig());
    }
}
