package com.deepansh.assistant.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A durable fact about the user.
 *
 * Stored as one entry of memories.json by {@link FileMemoryStore}, or as a
 * document of the assistant_memories collection by {@link MongoMemoryStore}.
 */
@Document(collection = "assistant_memories")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryItem {

    @Id
    private String id;

    @Indexed
    private MemoryType type;

    private String content;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    /** In [0, 1]; multiplies the relevance score during recall */
    @Builder.Default
    private double importance = 0.5;

    @Indexed
    private Instant createdAt;

    private Instant updatedAt;

    private int accessCount;
}
