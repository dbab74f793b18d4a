package com.deepansh.assistant.tool.impl;

import com.deepansh.assistant.memory.FileMemoryStore;
import com.deepansh.assistant.memory.MemoryItem;
import com.deepansh.assistant.memory.MemoryManager;
import com.deepansh.assistant.memory.MemoryType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MemoryToolsTest {

    @TempDir
    Path tempDir;

    private MemoryManager memoryManager;
    private SaveMemoryTool saveTool;
    private SearchMemoryTool searchTool;

    @BeforeEach
    void setUp() {
        memoryManager = new MemoryManager(new FileMemoryStore(tempDir, new ObjectMapper()), 0.6);
        saveTool = new SaveMemoryTool(memoryManager);
        searchTool = new SearchMemoryTool(memoryManager);
    }

    @Test
    void save_storesTypedMemory() {
        String result = saveTool.execute(Map.of("content", "用户喜欢简洁的回答", "type", "user_preference", "importance", 0.9));

        assertThat(result).startsWith("记忆已保存").contains("类型=user_preference");
        MemoryItem stored = memoryManager.getByType(MemoryType.USER_PREFERENCE).get(0);
        assertThat(stored.getContent()).isEqualTo("用户喜欢简洁的回答");
        assertThat(stored.getImportance()).isEqualTo(0.9);
    }

    @Test
    void save_unknownType_returnsError() {
        assertThat(saveTool.execute(Map.of("content", "x", "type", "secret")))
                .isEqualTo("错误: 未知的记忆类型 - secret");
        assertThat(memoryManager.listAll()).isEmpty();
    }

    @Test
    void search_keywordMode_ranksByRelevance() {
        memoryManager.addMemory(MemoryType.TOPIC_INTEREST, "对 kubernetes 感兴趣", 0.5, Map.of());
        memoryManager.addMemory(MemoryType.FACT, "住在杭州", 0.5, Map.of());

        String result = searchTool.execute(Map.of("query", "kubernetes", "mode", "keyword", "limit", 5));

        assertThat(result).startsWith("找到 1 条记忆").contains("[topic_interest] 对 kubernetes 感兴趣");
    }

    @Test
    void search_typeMode_listsCategory() {
        memoryManager.addMemory(MemoryType.FACT, "住在杭州", 0.5, Map.of());
        memoryManager.addMemory(MemoryType.USER_INFO, "我叫小明", 0.5, Map.of());

        assertThat(searchTool.execute(Map.of("query", "user_info", "mode", "type")))
                .contains("我叫小明")
                .doesNotContain("住在杭州");
    }

    @Test
    void search_nothingFound() {
        assertThat(searchTool.execute(Map.of("query", "rust", "mode", "keyword")))
                .isEqualTo("没有找到相关记忆 (查询: 'rust')");
    }
}
