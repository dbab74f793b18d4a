package com.deepansh.assistant.memory;

import com.deepansh.assistant.exception.AgentException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Long-term memory facade used by the agent loop, the memory tools and the API.
 *
 * The loop only reads through {@link #recall}/{@link #formatForContext} and
 * appends through {@link #extractAndSave}/{@link #addMemory}; existing items are
 * never rewritten here.
 */
@Slf4j
public class MemoryManager {

    static final String CONTEXT_HEADER = "[用户相关记忆]";

    private static final DateTimeFormatter ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final int SOURCE_PREVIEW_CHARS = 100;

    private final MemoryStore store;
    private final Clock clock;
    private final double extractionImportance;
    private final AtomicLong counter = new AtomicLong();

    public MemoryManager(MemoryStore store, double extractionImportance) {
        this(store, extractionImportance, Clock.systemDefaultZone());
    }

    MemoryManager(MemoryStore store, double extractionImportance, Clock clock) {
        this.store = store;
        this.extractionImportance = extractionImportance;
        this.clock = clock;
    }

    public MemoryItem addMemory(MemoryType type, String content, double importance, Map<String, Object> metadata) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("memory content must not be blank");
        }
        Instant now = clock.instant();
        MemoryItem item = MemoryItem.builder()
                .id(nextId())
                .type(type)
                .content(content.trim())
                .metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>())
                .importance(Math.max(0.0, Math.min(1.0, importance)))
                .createdAt(now)
                .updatedAt(now)
                .build();

        if (!store.save(item)) {
            throw new AgentException("Failed to persist memory [" + type.value() + "]");
        }
        log.info("Stored memory [id={}, type={}]", item.getId(), type.value());
        return item;
    }

    public List<MemoryItem> recall(String query, int topK) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return store.search(query, topK);
    }

    /**
     * Bulleted block for the system prompt, or an empty string when nothing
     * relevant was found (callers then omit the block).
     */
    public String formatForContext(String query, int maxItems) {
        List<MemoryItem> memories = recall(query, maxItems);
        if (memories.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(CONTEXT_HEADER);
        memories.forEach(m -> sb.append("\n- [")
                .append(m.getType() != null ? m.getType().value() : "fact")
                .append("] ")
                .append(m.getContent()));
        return sb.toString();
    }

    /**
     * Persists classified fragments of a user message. Unrecognized kinds and
     * blank fragments are skipped.
     */
    public List<MemoryItem> extractAndSave(String userMessage,
                                           String assistantResponse,
                                           Map<String, List<String>> classifiedFragments) {
        if (classifiedFragments == null || classifiedFragments.isEmpty()) {
            return List.of();
        }
        String source = userMessage == null ? ""
                : userMessage.substring(0, Math.min(SOURCE_PREVIEW_CHARS, userMessage.length()));

        List<MemoryItem> saved = new ArrayList<>();
        classifiedFragments.forEach((kind, fragments) -> {
            Optional<MemoryType> type = MemoryType.parse(kind);
            if (type.isEmpty()) {
                log.debug("Skipping fragments with unknown memory kind [{}]", kind);
                return;
            }
            for (String fragment : fragments) {
                if (fragment == null || fragment.isBlank()) {
                    continue;
                }
                saved.add(addMemory(type.get(), fragment, extractionImportance,
                        Map.of("source_user_msg", source)));
            }
        });
        return saved;
    }

    /** Memory contents grouped by kind: preferences, info, interests, facts. */
    public Map<String, List<String>> getUserProfile() {
        Map<String, List<String>> profile = new LinkedHashMap<>();
        profile.put("preferences", contents(MemoryType.USER_PREFERENCE));
        profile.put("info", contents(MemoryType.USER_INFO));
        profile.put("interests", contents(MemoryType.TOPIC_INTEREST));
        profile.put("facts", contents(MemoryType.FACT));
        return profile;
    }

    public Optional<MemoryItem> get(String id) {
        return store.get(id);
    }

    public List<MemoryItem> getByType(MemoryType type) {
        return store.getByType(type);
    }

    public List<MemoryItem> listAll() {
        return store.listAll();
    }

    public boolean delete(String id) {
        boolean deleted = store.delete(id);
        if (deleted) {
            log.info("Deleted memory [id={}]", id);
        }
        return deleted;
    }

    private List<String> contents(MemoryType type) {
        return store.getByType(type).stream().map(MemoryItem::getContent).toList();
    }

    private String nextId() {
        String timestamp = LocalDateTime.now(clock).format(ID_TIMESTAMP);
        return "mem_" + timestamp + "_" + counter.incrementAndGet();
    }
}
