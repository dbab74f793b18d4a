package com.deepansh.assistant.memory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB-backed memory store (collection: assistant_memories).
 *
 * Ranking happens in application code over the documents in creation order,
 * the same way the file store ranks, so recall behaves identically on both.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoMemoryStore implements MemoryStore {

    private static final Sort INSERTION_ORDER = Sort.by(Sort.Direction.ASC, "createdAt");

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean save(MemoryItem item) {
        try {
            mongoTemplate.save(item);
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to save memory [id={}]: {}", item.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<MemoryItem> get(String id) {
        MemoryItem item = mongoTemplate.findAndModify(
                Query.query(Criteria.where("_id").is(id)),
                new Update().inc("accessCount", 1),
                FindAndModifyOptions.options().returnNew(true),
                MemoryItem.class);
        return Optional.ofNullable(item);
    }

    @Override
    public List<MemoryItem> search(String query, int topK) {
        List<MemoryItem> ranked = MemoryRanker.rank(listAll(), query, topK);
        if (!ranked.isEmpty()) {
            List<String> ids = ranked.stream().map(MemoryItem::getId).toList();
            mongoTemplate.updateMulti(
                    Query.query(Criteria.where("_id").in(ids)),
                    new Update().inc("accessCount", 1),
                    MemoryItem.class);
            ranked.forEach(item -> item.setAccessCount(item.getAccessCount() + 1));
        }
        return ranked;
    }

    @Override
    public List<MemoryItem> getByType(MemoryType type) {
        return mongoTemplate.find(
                Query.query(Criteria.where("type").is(type)).with(INSERTION_ORDER),
                MemoryItem.class);
    }

    @Override
    public boolean delete(String id) {
        return mongoTemplate.remove(Query.query(Criteria.where("_id").is(id)), MemoryItem.class)
                .getDeletedCount() > 0;
    }

    @Override
    public List<MemoryItem> listAll() {
        return mongoTemplate.find(new Query().with(INSERTION_ORDER), MemoryItem.class);
    }
}
