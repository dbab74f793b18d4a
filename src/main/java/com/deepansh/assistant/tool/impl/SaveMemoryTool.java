package com.deepansh.assistant.tool.impl;

import com.deepansh.assistant.memory.MemoryItem;
import com.deepansh.assistant.memory.MemoryManager;
import com.deepansh.assistant.memory.MemoryType;
import com.deepansh.assistant.tool.AgentTool;
import com.deepansh.assistant.tool.ToolArguments;
import com.deepansh.assistant.tool.ToolParameter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Lets the model persist a fact about the user explicitly, alongside the
 * automatic capture that runs after each turn.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SaveMemoryTool implements AgentTool {

    private static final double DEFAULT_IMPORTANCE = 0.7;

    private final MemoryManager memoryManager;

    @Override
    public String getName() {
        return "save_memory";
    }

    @Override
    public String getDescription() {
        return """
                将关于用户的重要信息保存到长期记忆，供以后的对话使用。
                当用户分享偏好、个人信息、感兴趣的话题或值得记住的事实时使用。
                不要用于临时请求或一次性任务。""";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(
                ToolParameter.builder()
                        .name("content")
                        .description("要记住的内容，写成一句清晰的陈述，如 '用户喜欢简洁的回答'")
                        .build(),
                ToolParameter.builder()
                        .name("type")
                        .description("记忆类别")
                        .required(false)
                        .enumValues(Arrays.stream(MemoryType.values()).map(MemoryType::value).toList())
                        .defaultValue(MemoryType.FACT.value())
                        .build(),
                ToolParameter.builder()
                        .name("importance")
                        .type("number")
                        .description("重要程度 0-1，默认" + DEFAULT_IMPORTANCE)
                        .required(false)
                        .defaultValue(DEFAULT_IMPORTANCE)
                        .build()
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String content = ToolArguments.string(arguments, "content", "");
        if (content.isBlank()) {
            return "错误: 记忆内容不能为空";
        }
        String rawType = ToolArguments.string(arguments, "type", MemoryType.FACT.value());
        MemoryType type = MemoryType.parse(rawType).orElse(null);
        if (type == null) {
            return "错误: 未知的记忆类型 - " + rawType;
        }
        double importance = ToolArguments.decimal(arguments, "importance", DEFAULT_IMPORTANCE);

        MemoryItem saved = memoryManager.addMemory(type, content, importance, Map.of("source", "save_memory"));
        log.info("Model saved memory [id={}, type={}]", saved.getId(), type.value());
        return "记忆已保存 [id=" + saved.getId() + ", 类型=" + type.value() + "]: " + saved.getContent();
    }
}
