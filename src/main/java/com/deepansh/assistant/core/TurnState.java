package com.deepansh.assistant.core;

import com.deepansh.assistant.model.ToolCall;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of a single turn, passed through the loop instead of living
 * in fields on AgentLoop.
 */
@Data
@Builder
public class TurnState {

    private String sessionId;

    /** User text with any image marker removed; used for recall and memory capture */
    private String userText;

    /** Context epoch read when the turn started */
    private long epoch;

    @Builder.Default
    private List<ToolCall> executedToolCalls = new ArrayList<>();

    private int toolRounds;
}
