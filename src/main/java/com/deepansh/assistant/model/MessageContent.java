package com.deepansh.assistant.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Content of a user turn as produced by the multimodal builder:
 * either plain text or an ordered list of parts.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class MessageContent {

    private final String text;
    private final List<ContentPart> parts;

    private MessageContent(String text, List<ContentPart> parts) {
        this.text = text;
        this.parts = parts;
    }

    public static MessageContent text(String text) {
        return new MessageContent(text != null ? text : "", null);
    }

    public static MessageContent ofParts(List<ContentPart> parts) {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("structured content needs at least one part");
        }
        return new MessageContent(null, List.copyOf(parts));
    }

    public boolean isMultimodal() {
        return parts != null;
    }
}
