package com.deepansh.assistant.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Provider-agnostic result of one chat call.
 */
@Data
@Builder
public class LlmResponse {

    /** May be null or empty when the model only emitted tool calls */
    private String content;

    /** Tool calls in the order the provider emitted them */
    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();

    private String finishReason;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
