package com.deepansh.assistant.api;

import com.deepansh.assistant.tool.ToolDefinition;
import com.deepansh.assistant.tool.ToolRegistry;
import com.deepansh.assistant.tool.impl.DocumentSearchTool;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/tools")
@RequiredArgsConstructor
public class ToolController {

    private final ToolRegistry toolRegistry;
    private final DocumentSearchTool documentSearchTool;

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> list() {
        return ResponseEntity.ok(toolRegistry.getAllDefinitions().stream()
                .map(ToolDefinition::toAnthropicSchema)
                .toList());
    }

    @PostMapping("/documents/reload")
    public ResponseEntity<Map<String, Object>> reloadDocuments() {
        int loaded = documentSearchTool.reload();
        return ResponseEntity.ok(Map.of("documents", loaded));
    }
}
