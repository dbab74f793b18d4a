package com.deepansh.assistant.llm;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The fixed set of supported backends.
 */
public enum LlmProvider {

    OPENAI("openai", ApiFamily.OPENAI_COMPATIBLE, "https://api.openai.com/v1", "gpt-4o-mini"),
    ANTHROPIC("anthropic", ApiFamily.ANTHROPIC, "https://api.anthropic.com/v1", "claude-3-5-sonnet-20241022"),
    DEEPSEEK("deepseek", ApiFamily.OPENAI_COMPATIBLE, "https://api.deepseek.com", "deepseek-chat"),
    ZHIPU("zhipu", ApiFamily.OPENAI_COMPATIBLE, "https://open.bigmodel.cn/api/paas/v4", "glm-4"),
    QWEN("qwen", ApiFamily.OPENAI_COMPATIBLE, "https://dashscope.aliyuncs.com/compatible-mode/v1", "qwen-turbo");

    public enum ApiFamily {
        OPENAI_COMPATIBLE, ANTHROPIC
    }

    private final String id;
    private final ApiFamily family;
    private final String defaultBaseUrl;
    private final String defaultModel;

    LlmProvider(String id, ApiFamily family, String defaultBaseUrl, String defaultModel) {
        this.id = id;
        this.family = family;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultModel = defaultModel;
    }

    public String id() {
        return id;
    }

    public ApiFamily family() {
        return family;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    public String defaultModel() {
        return defaultModel;
    }

    /** Environment variable conventionally holding this provider's key. */
    public String apiKeyEnvVar() {
        return name() + "_API_KEY";
    }

    public static LlmProvider fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (LlmProvider provider : values()) {
                if (provider.id.equals(normalized)) {
                    return provider;
                }
            }
        }
        String known = Arrays.stream(values()).map(LlmProvider::id).collect(Collectors.joining(", "));
        throw new LlmConfigurationException(String.valueOf(id),
                "Unknown LLM provider '" + id + "'. Supported providers: " + known);
    }
}
