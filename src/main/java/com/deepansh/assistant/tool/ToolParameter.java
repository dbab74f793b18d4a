package com.deepansh.assistant.tool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolParameter {

    private String name;

    /** JSON Schema type: string, number, integer, boolean, array or object */
    @Builder.Default
    private String type = "string";

    private String description;

    @Builder.Default
    private boolean required = true;

    private List<String> enumValues;

    private Object defaultValue;

    Map<String, Object> toSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", type);
        schema.put("description", description != null ? description : "");
        if (enumValues != null && !enumValues.isEmpty()) {
            schema.put("enum", enumValues);
        }
        if (defaultValue != null) {
            schema.put("default", defaultValue);
        }
        return schema;
    }
}
