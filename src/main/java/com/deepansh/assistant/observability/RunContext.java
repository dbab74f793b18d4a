package com.deepansh.assistant.observability;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Timing and token accounting for a single turn. One instance per turn,
 * never shared between threads.
 */
@Getter
public class RunContext {

    private final long startedAtMs;
    private final List<ToolTiming> toolTimings = new ArrayList<>();

    private int providerCalls;
    private long providerTimeMs;
    private int promptTokens;
    private int completionTokens;

    public RunContext() {
        this(System.currentTimeMillis());
    }

    RunContext(long startedAtMs) {
        this.startedAtMs = startedAtMs;
    }

    public void providerCallFinished(long latencyMs, int prompt, int completion) {
        providerCalls++;
        providerTimeMs += latencyMs;
        promptTokens += prompt;
        completionTokens += completion;
    }

    public void toolCallFinished(String toolName, long latencyMs, boolean failed) {
        toolTimings.add(new ToolTiming(toolName, latencyMs, failed));
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startedAtMs;
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    public long toolTimeMs() {
        return toolTimings.stream().mapToLong(ToolTiming::latencyMs).sum();
    }

    /** e.g. {@code calculator=3ms, web_search=412ms(failed)}; "-" when no tool ran. */
    public String toolSummary() {
        if (toolTimings.isEmpty()) {
            return "-";
        }
        return toolTimings.stream()
                .map(t -> t.toolName() + "=" + t.latencyMs() + "ms" + (t.failed() ? "(failed)" : ""))
                .collect(Collectors.joining(", "));
    }

    public record ToolTiming(String toolName, long latencyMs, boolean failed) {}
}
