package com.deepansh.assistant.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ChatRequest {

    @NotBlank(message = "input must not be blank")
    private String input;

    /**
     * Optional. If provided, the turn continues that conversation;
     * otherwise a new session is created.
     */
    private String sessionId;

    /** Optional image reference; takes precedence over an inline [image:...] marker. */
    private String imagePath;

    /** Optional provider id (openai, anthropic, deepseek, zhipu, qwen). */
    private String provider;
}
