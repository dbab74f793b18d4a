package com.deepansh.assistant.tool.impl;

import com.deepansh.assistant.memory.MemoryItem;
import com.deepansh.assistant.memory.MemoryManager;
import com.deepansh.assistant.memory.MemoryType;
import com.deepansh.assistant.tool.AgentTool;
import com.deepansh.assistant.tool.ToolArguments;
import com.deepansh.assistant.tool.ToolParameter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Searches long-term memory.
 *
 * Modes:
 * - keyword: relevance-ranked recall (default)
 * - type:    every memory of one category, query holds the category name
 * - all:     everything ("what do you know about me?")
 */
@Component
@RequiredArgsConstructor
public class SearchMemoryTool implements AgentTool {

    private final MemoryManager memoryManager;

    @Override
    public String getName() {
        return "search_memory";
    }

    @Override
    public String getDescription() {
        return """
                搜索关于用户的长期记忆。
                mode 为 'keyword'（默认）时按相关度检索；'type' 按类别列出，query 填类别名；
                'all' 返回全部记忆。""";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(
                ToolParameter.builder()
                        .name("query")
                        .description("检索关键词，或 type 模式下的类别名 (user_preference | user_info | topic_interest | interaction | fact)")
                        .required(false)
                        .build(),
                ToolParameter.builder()
                        .name("mode")
                        .description("检索模式")
                        .required(false)
                        .enumValues(List.of("keyword", "type", "all"))
                        .defaultValue("keyword")
                        .build(),
                ToolParameter.builder()
                        .name("limit")
                        .type("integer")
                        .description("最多返回条数，默认5")
                        .required(false)
                        .defaultValue(5)
                        .build()
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String query = ToolArguments.string(arguments, "query", "");
        String mode = ToolArguments.string(arguments, "mode", "keyword");
        int limit = Math.max(1, ToolArguments.integer(arguments, "limit", 5));

        List<MemoryItem> results = switch (mode) {
            case "type" -> MemoryType.parse(query).map(memoryManager::getByType).orElse(List.of());
            case "all" -> memoryManager.listAll();
            default -> query.isBlank() ? memoryManager.listAll() : memoryManager.recall(query, limit);
        };

        if (results.isEmpty()) {
            return "没有找到相关记忆" + (query.isBlank() ? "" : " (查询: '" + query + "')");
        }
        return "找到 " + results.size() + " 条记忆:\n" + results.stream()
                .map(m -> String.format("  [%s] %s (id=%s)",
                        m.getType() != null ? m.getType().value() : "fact", m.getContent(), m.getId()))
                .collect(Collectors.joining("\n"));
    }
}
