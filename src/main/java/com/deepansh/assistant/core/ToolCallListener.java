package com.deepansh.assistant.core;

/**
 * Observer of tool execution during a turn. Called synchronously on the turn's
 * thread, before and after each tool runs. Exceptions thrown here are logged
 * and otherwise ignored.
 */
public interface ToolCallListener {

    ToolCallListener NONE = new ToolCallListener() {};

    default void onToolCall(String toolName, String arguments) {
    }

    default void onToolResult(String toolName, String result) {
    }
}
