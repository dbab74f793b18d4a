package com.deepansh.assistant.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** Provider-assigned id, echoed back on the matching tool result message */
    private String id;

    private String toolName;

    /** Raw JSON object text exactly as the provider emitted it */
    private String arguments;
}
