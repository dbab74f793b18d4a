package com.deepansh.assistant.memory;

import com.mongodb.client.result.DeleteResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoMemoryStoreTest {

    @Mock MongoTemplate mongoTemplate;

    @InjectMocks
    MongoMemoryStore store;

    @Test
    void save_writeFailure_reportsFalse() {
        MemoryItem item = item("m1", "x");
        doThrow(new DataAccessResourceFailureException("down")).when(mongoTemplate).save(item);

        assertThat(store.save(item)).isFalse();
    }

    @Test
    void get_incrementsAccessCountAtomically() {
        MemoryItem item = item("m1", "住在杭州");
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class),
                eq(MemoryItem.class))).thenReturn(item);

        assertThat(store.get("m1")).contains(item);
    }

    @Test
    void search_ranksInProcessAndCountsAccess() {
        when(mongoTemplate.find(any(Query.class), eq(MemoryItem.class)))
                .thenReturn(List.of(item("m1", "喜欢猫"), item("m2", "住在杭州")));

        List<MemoryItem> found = store.search("杭州", 5);

        assertThat(found).extracting(MemoryItem::getId).containsExactly("m2");
        assertThat(found.get(0).getAccessCount()).isEqualTo(1);
        verify(mongoTemplate).updateMulti(any(Query.class), any(Update.class), eq(MemoryItem.class));
    }

    @Test
    void search_noMatch_skipsUpdate() {
        when(mongoTemplate.find(any(Query.class), eq(MemoryItem.class))).thenReturn(List.of(item("m1", "喜欢猫")));

        assertThat(store.search("kubernetes", 5)).isEmpty();
        verify(mongoTemplate, never()).updateMulti(any(Query.class), any(Update.class), eq(MemoryItem.class));
    }

    @Test
    void delete_reportsWhetherDocumentWasRemoved() {
        when(mongoTemplate.remove(any(Query.class), eq(MemoryItem.class)))
                .thenReturn(DeleteResult.acknowledged(1))
                .thenReturn(DeleteResult.acknowledged(0));

        assertThat(store.delete("m1")).isTrue();
        assertThat(store.delete("m1")).isFalse();
    }

    private static MemoryItem item(String id, String content) {
        return MemoryItem.builder()
                .id(id)
                .type(MemoryType.FACT)
                .content(content)
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
    }
}
