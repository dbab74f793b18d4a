package com.deepansh.assistant.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;

    /** Plain text content. Null when the message carries structured {@link #parts}. */
    private String content;

    /** Ordered text/image parts for multimodal user or assistant messages. */
    private List<ContentPart> parts;

    /** Present when role = tool: links back to the assistant's tool call id */
    private String toolCallId;

    /** Present when role = tool: the name of the tool that produced this result */
    private String name;

    /**
     * Present when role = assistant and the model requested tool calls.
     * Echoed back on the next request so results can be correlated by id.
     */
    private List<ToolCall> toolCalls;

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message user(MessageContent content) {
        return Message.builder()
                .role(Role.user)
                .content(content.isMultimodal() ? null : content.getText())
                .parts(content.isMultimodal() ? content.getParts() : null)
                .build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }

    public static Message assistantToolCalls(String content, List<ToolCall> toolCalls) {
        return Message.builder()
                .role(Role.assistant)
                .content(content != null ? content : "")
                .toolCalls(List.copyOf(toolCalls))
                .build();
    }

    public static Message tool(String toolCallId, String toolName, String result) {
        return Message.builder()
                .role(Role.tool)
                .toolCallId(toolCallId)
                .name(toolName)
                .content(result)
                .build();
    }

    @JsonIgnore
    public boolean isMultimodal() {
        return parts != null && !parts.isEmpty();
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /** Text view of the message: the plain content, or the joined text parts. */
    public String textContent() {
        if (!isMultimodal()) {
            return content != null ? content : "";
        }
        return parts.stream()
                .filter(p -> p.getType() == ContentPart.Type.text)
                .map(ContentPart::getText)
                .collect(Collectors.joining("\n"));
    }
}
