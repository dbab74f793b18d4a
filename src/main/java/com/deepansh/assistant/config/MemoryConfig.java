package com.deepansh.assistant.config;

import com.deepansh.assistant.memory.FileMemoryStore;
import com.deepansh.assistant.memory.MemoryManager;
import com.deepansh.assistant.memory.MemoryStore;
import com.deepansh.assistant.memory.MongoMemoryStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;

/**
 * Selects the memory store with agent.memory.store (file by default, or mongo).
 */
@Configuration
@Slf4j
public class MemoryConfig {

    @Bean
    @ConditionalOnProperty(name = "agent.memory.store", havingValue = "file", matchIfMissing = true)
    public MemoryStore fileMemoryStore(AgentProperties properties, ObjectMapper objectMapper) {
        Path directory = Path.of(properties.getMemory().getStoragePath());
        log.info("Memory store: file [{}]", directory.toAbsolutePath());
        return new FileMemoryStore(directory, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "agent.memory.store", havingValue = "mongo")
    public MemoryStore mongoMemoryStore(MongoTemplate mongoTemplate) {
        log.info("Memory store: mongo");
        return new MongoMemoryStore(mongoTemplate);
    }

    @Bean
    public MemoryManager memoryManager(MemoryStore memoryStore, AgentProperties properties) {
        return new MemoryManager(memoryStore, properties.getMemory().getExtractionImportance());
    }
}
