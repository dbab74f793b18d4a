package com.deepansh.assistant.llm;

import lombok.Data;

/**
 * Holds config for a single LLM provider.
 * Blank base URL or model fall back to the provider's defaults.
 */
@Data
public class LlmProviderProperties {
    private String apiKey = "";
    private String baseUrl = "";
    private String model = "";
    private int maxTokens = 4096;
    private double temperature = 0.7;
    private int timeoutSeconds = 60;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
