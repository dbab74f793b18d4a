package com.deepansh.assistant.tool;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a tool's schema sent to the model.
 * Decouples provider wire formats from the AgentTool implementation.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;

    @Builder.Default
    private List<ToolParameter> parameters = List.of();

    public static ToolDefinition from(AgentTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .parameters(tool.getParameters() != null ? List.copyOf(tool.getParameters()) : List.of())
                .build();
    }

    /** JSON Schema object describing the parameters, in declaration order. */
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ToolParameter p : parameters) {
            properties.put(p.getName(), p.toSchema());
            if (p.isRequired()) {
                required.add(p.getName());
            }
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    /**
     * OpenAI-compatible shape:
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("description", description);
        function.put("parameters", toJsonSchema());
        return Map.of("type", "function", "function", function);
    }

    /** Anthropic shape: { "name", "description", "input_schema" } */
    public Map<String, Object> toAnthropicSchema() {
        Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("name", name);
        tool.put("description", description);
        tool.put("input_schema", toJsonSchema());
        return tool;
    }
}
