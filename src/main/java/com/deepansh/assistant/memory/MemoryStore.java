package com.deepansh.assistant.memory;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for memory items. Implementations keep insertion order so that
 * equally relevant items come back oldest first.
 */
public interface MemoryStore {

    /** Inserts or replaces by id. Returns false when the item could not be persisted. */
    boolean save(MemoryItem item);

    /** Looks up one item and counts the access. */
    Optional<MemoryItem> get(String id);

    /** Highest-scoring items first; counts an access on each returned item. */
    List<MemoryItem> search(String query, int topK);

    List<MemoryItem> getByType(MemoryType type);

    boolean delete(String id);

    List<MemoryItem> listAll();
}
