package com.deepansh.assistant.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps all memories in memory and mirrors them to {@code memories.json}
 * under the storage directory after every change.
 *
 * The file is a JSON array in insertion order. A file that cannot be parsed
 * is logged and treated as empty; it is overwritten on the next save.
 */
@Slf4j
public class FileMemoryStore implements MemoryStore {

    static final String FILE_NAME = "memories.json";

    private static final TypeReference<List<MemoryItem>> ITEMS_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, MemoryItem> items = new LinkedHashMap<>();

    public FileMemoryStore(Path storageDirectory, ObjectMapper objectMapper) {
        this.file = storageDirectory.resolve(FILE_NAME);
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(storageDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create memory directory " + storageDirectory, e);
        }
        load();
    }

    @Override
    public synchronized boolean save(MemoryItem item) {
        items.put(item.getId(), item);
        try {
            persist();
            return true;
        } catch (IOException e) {
            log.error("Failed to write {}: {}", file, e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized Optional<MemoryItem> get(String id) {
        MemoryItem item = items.get(id);
        if (item == null) {
            return Optional.empty();
        }
        item.setAccessCount(item.getAccessCount() + 1);
        persistQuietly();
        return Optional.of(item);
    }

    @Override
    public synchronized List<MemoryItem> search(String query, int topK) {
        List<MemoryItem> ranked = MemoryRanker.rank(items.values(), query, topK);
        if (!ranked.isEmpty()) {
            ranked.forEach(item -> item.setAccessCount(item.getAccessCount() + 1));
            persistQuietly();
        }
        return ranked;
    }

    @Override
    public synchronized List<MemoryItem> getByType(MemoryType type) {
        return items.values().stream()
                .filter(item -> item.getType() == type)
                .toList();
    }

    @Override
    public synchronized boolean delete(String id) {
        if (items.remove(id) == null) {
            return false;
        }
        persistQuietly();
        return true;
    }

    @Override
    public synchronized List<MemoryItem> listAll() {
        return new ArrayList<>(items.values());
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            List<MemoryItem> loaded = objectMapper.readValue(file.toFile(), ITEMS_TYPE);
            if (loaded != null) {
                loaded.forEach(item -> items.put(item.getId(), item));
            }
            log.info("Loaded {} memories from {}", items.size(), file);
        } catch (IOException e) {
            log.error("Could not read {}, starting with an empty memory: {}", file, e.getMessage());
        }
    }

    private void persist() throws IOException {
        Path tmp = file.resolveSibling(FILE_NAME + ".tmp");
        objectMapper.writeValue(tmp.toFile(), new ArrayList<>(items.values()));
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }

    private void persistQuietly() {
        try {
            persist();
        } catch (IOException e) {
            log.warn("Failed to update {}: {}", file, e.getMessage());
        }
    }
}
