package com.deepansh.assistant.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String reply;
    private String sessionId;

    @Builder.Default
    private List<ToolCall> toolCallsExecuted = new ArrayList<>();

    /** Number of tool-execution rounds run during the turn */
    private int toolRounds;
    private boolean maxIterationsReached;

    private int promptTokens;
    private int completionTokens;

    /** Wall-clock time of the whole turn, tools included */
    private long latencyMs;

    /** True when the conversation was reset while this turn was in flight */
    private boolean discarded;
}
