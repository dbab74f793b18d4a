package com.deepansh.assistant.config;

import com.deepansh.assistant.llm.LlmProviderProperties;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider credentials and client tuning, bound from the "llm" prefix.
 * Provider entries are keyed by provider id (openai, anthropic, deepseek, zhipu, qwen).
 */
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProperties {

    private String defaultProvider = "openai";

    private Map<String, LlmProviderProperties> providers = new LinkedHashMap<>();

    private Retry retry = new Retry();

    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private long waitMs = 2000;
        private double multiplier = 2.0;
    }

    @Data
    public static class CircuitBreaker {
        private float failureRateThreshold = 50;
        private int slidingWindowSize = 10;
        private int waitInOpenStateSeconds = 30;
    }
}
