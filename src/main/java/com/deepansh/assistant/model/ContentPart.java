package com.deepansh.assistant.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One element of structured message content. Image parts hold a reference
 * (local path, http(s) URL or data URI); providers resolve local paths
 * before anything goes on the wire.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentPart {

    public enum Type {
        text, image
    }

    private Type type;
    private String text;
    private String imageUrl;

    public static ContentPart text(String text) {
        return new ContentPart(Type.text, text, null);
    }

    public static ContentPart image(String imageUrl) {
        return new ContentPart(Type.image, null, imageUrl);
    }
}
