package com.purchasingpower.codelod.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Connection settings for hosted providers. The key is only checked when the provider is selected.
 */
@Data
public class ApiProviderProperties {

    private String apiKey;

    private String defaultModel;

    @Min(1)
    private int timeoutSeconds = 60;

    @Min(0)
    private int maxRetries = 2;
}
