package com.purchasingpower.codelod.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OllamaProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String defaultModel = "qwen2.5-coder:7b";

    @Min(1)
    private int timeoutSeconds = 120;

    @Min(0)
    private int maxRetries = 2;
}
