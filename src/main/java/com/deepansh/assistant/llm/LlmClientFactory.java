package com.deepansh.assistant.llm;

import com.deepansh.assistant.config.HttpClientConfig;
import com.deepansh.assistant.config.LlmProperties;
import com.deepansh.assistant.resilience.ResilientLlmClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Lazily creates and caches one client per provider.
 *
 * Clients are built on first use, wrapped in {@link ResilientLlmClient} and then
 * shared by every conversation. A provider without an API key cannot be built;
 * asking for it raises {@link LlmConfigurationException} naming the provider and
 * the variable to set.
 */
@Component
@Slf4j
public class LlmClientFactory {

    private final LlmProperties properties;
    private final ObjectMapper objectMapper;
    private final ImageInliner imageInliner;
    private final Function<Duration, RestClient.Builder> restClientBuilders;
    private final Map<LlmProvider, LlmClient> clients = new ConcurrentHashMap<>();

    @Autowired
    public LlmClientFactory(LlmProperties properties, ObjectMapper objectMapper, ImageInliner imageInliner) {
        this(properties, objectMapper, imageInliner, HttpClientConfig::builderWithTimeout);
    }

    LlmClientFactory(LlmProperties properties,
                     ObjectMapper objectMapper,
                     ImageInliner imageInliner,
                     Function<Duration, RestClient.Builder> restClientBuilders) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.imageInliner = imageInliner;
        this.restClientBuilders = restClientBuilders;
    }

    @PostConstruct
    public void logProviders() {
        log.info("================================================================");
        for (LlmProvider provider : LlmProvider.values()) {
            LlmProviderProperties p = properties.getProviders().get(provider.id());
            if (p != null && p.hasApiKey()) {
                log.info("  {} key: {}", provider.id(), mask(p.getApiKey()));
            } else {
                log.info("  {} not configured (set {})", provider.id(), provider.apiKeyEnvVar());
            }
        }
        List<LlmProvider> available = availableProviders();
        log.info("  Default provider    : {}", available.isEmpty() ? "none" : defaultProvider().id());
        log.info("================================================================");
    }

    /** Client for the given provider id, or the default provider when the id is blank. */
    public LlmClient getClient(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            return getClient(defaultProvider());
        }
        return getClient(LlmProvider.fromId(providerId));
    }

    public LlmClient getClient(LlmProvider provider) {
        return clients.computeIfAbsent(provider, this::create);
    }

    /**
     * The configured default when it has a key, otherwise the first configured
     * provider in declaration order.
     */
    public LlmProvider defaultProvider() {
        LlmProvider configured = LlmProvider.fromId(properties.getDefaultProvider());
        if (isConfigured(configured)) {
            return configured;
        }
        return availableProviders().stream()
                .findFirst()
                .orElseThrow(() -> new LlmConfigurationException(configured.id(),
                        "No LLM provider is configured. Set " + configured.apiKeyEnvVar()
                        + " or the API key of another provider."));
    }

    public List<LlmProvider> availableProviders() {
        return Arrays.stream(LlmProvider.values())
                .filter(this::isConfigured)
                .toList();
    }

    private boolean isConfigured(LlmProvider provider) {
        LlmProviderProperties p = properties.getProviders().get(provider.id());
        return p != null && p.hasApiKey();
    }

    private LlmClient create(LlmProvider provider) {
        LlmProviderProperties resolved = resolve(provider);
        RestClient.Builder builder = restClientBuilders.apply(Duration.ofSeconds(resolved.getTimeoutSeconds()));

        LlmClient client = switch (provider.family()) {
            case ANTHROPIC -> new AnthropicClient(resolved, objectMapper, imageInliner, builder);
            case OPENAI_COMPATIBLE -> new OpenAiCompatibleClient(provider, resolved, objectMapper, imageInliner, builder);
        };
        log.info("Created {} client [model={}, baseUrl={}]", provider.id(), resolved.getModel(), resolved.getBaseUrl());
        return new ResilientLlmClient(client, properties.getRetry(), properties.getCircuitBreaker());
    }

    private LlmProviderProperties resolve(LlmProvider provider) {
        LlmProviderProperties configured = properties.getProviders().get(provider.id());
        if (configured == null || !configured.hasApiKey()) {
            throw new LlmConfigurationException(provider.id(),
                    "No API key configured for provider '" + provider.id() + "'. Set " + provider.apiKeyEnvVar() + ".");
        }

        LlmProviderProperties resolved = new LlmProviderProperties();
        resolved.setApiKey(configured.getApiKey());
        resolved.setBaseUrl(isBlank(configured.getBaseUrl()) ? provider.defaultBaseUrl() : configured.getBaseUrl());
        resolved.setModel(isBlank(configured.getModel()) ? provider.defaultModel() : configured.getModel());
        resolved.setMaxTokens(configured.getMaxTokens());
        resolved.setTemperature(configured.getTemperature());
        resolved.setTimeoutSeconds(configured.getTimeoutSeconds() > 0 ? configured.getTimeoutSeconds() : 60);
        return resolved;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String mask(String key) {
        return key.substring(0, Math.min(6, key.length())) + "..."
                + (key.length() > 10 ? key.substring(key.length() - 4) : "");
    }
}
