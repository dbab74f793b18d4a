package com.deepansh.assistant.llm;

import com.deepansh.assistant.model.LlmResponse;
import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.tool.ToolDefinition;

import java.util.List;
import java.util.stream.Stream;

public interface LlmClient {

    LlmProvider provider();

    /**
     * Send the conversation and available tool schemas to the model.
     *
     * @param messages  system prompt, history and tool results in order
     * @param tools     tool definitions the model may invoke; empty or null for none
     * @return the normalized result: text content, tool calls and token usage
     * @throws LlmConfigurationException when credentials are missing or rejected
     * @throws LlmTransportException on network failure or an error status
     * @throws LlmResponseFormatException when the body cannot be interpreted
     */
    LlmResponse chat(List<Message> messages, List<ToolDefinition> tools);

    /**
     * Streams text deltas for a tool-free completion. The stream is lazy,
     * finite and single-use; closing it releases the connection.
     */
    Stream<String> chatStream(List<Message> messages);
}
