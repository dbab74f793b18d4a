package com.deepansh.assistant.api;

import com.deepansh.assistant.core.AgentLoop;
import com.deepansh.assistant.memory.MemoryItem;
import com.deepansh.assistant.memory.MemoryManager;
import com.deepansh.assistant.memory.MemoryType;
import com.deepansh.assistant.model.MemoryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/memory")
@RequiredArgsConstructor
public class MemoryController {

    private static final double DEFAULT_IMPORTANCE = 0.5;

    private final MemoryManager memoryManager;
    private final AgentLoop agentLoop;

    @GetMapping
    public ResponseEntity<List<MemoryItem>> listAll() {
        return ResponseEntity.ok(memoryManager.listAll());
    }

    @GetMapping("/profile")
    public ResponseEntity<Map<String, List<String>>> profile() {
        return ResponseEntity.ok(memoryManager.getUserProfile());
    }

    @GetMapping("/search")
    public ResponseEntity<List<MemoryItem>> search(@RequestParam String q,
                                                   @RequestParam(defaultValue = "5") int limit) {
        return ResponseEntity.ok(memoryManager.recall(q, limit));
    }

    @GetMapping("/type/{type}")
    public ResponseEntity<List<MemoryItem>> byType(@PathVariable String type) {
        return ResponseEntity.ok(memoryManager.getByType(MemoryType.fromValue(type)));
    }

    @PostMapping
    public ResponseEntity<MemoryItem> store(@Valid @RequestBody MemoryRequest request) {
        MemoryType type = MemoryType.fromValue(request.getType());
        double importance = request.getImportance() != null ? request.getImportance() : DEFAULT_IMPORTANCE;
        return ResponseEntity.ok(agentLoop.addMemory(type, request.getContent(), importance));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String id) {
        if (!memoryManager.delete(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("message", "Deleted", "id", id));
    }
}
