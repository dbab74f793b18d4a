package com.deepansh.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Conversation and orchestration settings, bound from the "agent" prefix.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    public static final String DEFAULT_SYSTEM_PROMPT = """
            你是一个智能助手，负责回答用户的问题并帮助完成任务。

            请遵循以下原则：
            1. 友好、专业，回答简洁并突出重点
            2. 需要查找资料、计算或获取时间时，调用合适的工具
            3. 记住用户分享的偏好和个人信息，并在后续对话中使用
            4. 可以理解用户提供的图片，也可以按需生成图片

            如果工具返回错误，请不要重复调用同一个工具，直接说明限制或根据已有知识回答。
            """;

    private String systemPrompt = DEFAULT_SYSTEM_PROMPT;

    /** Number of most recent non-system messages sent with each request */
    private int historyLimit = 10;

    /** Tool-execution rounds allowed per turn */
    private int maxToolIterations = 5;

    private String fallbackReply = "抱歉，我无法生成回复。";

    private boolean toolsEnabled = true;

    private boolean multimodalEnabled = true;

    private Memory memory = new Memory();

    @Data
    public static class Memory {
        private boolean enabled = true;

        /** file | mongo */
        private String store = "file";

        private String storagePath = "./data/memory";

        /** Items rendered into the system prompt per turn */
        private int recallLimit = 5;

        private double extractionImportance = 0.6;

        private Capture capture = new Capture();
    }

    /** Background pool that stores memorable fragments after each turn */
    @Data
    public static class Capture {
        private int threads = 2;
        private int queueCapacity = 100;
        private int shutdownWaitSeconds = 10;
    }
}
