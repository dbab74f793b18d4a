package com.deepansh.assistant.llm;

/**
 * The provider answered successfully but the body could not be mapped
 * into a canonical {@link com.deepansh.assistant.model.LlmResponse}.
 */
public class LlmResponseFormatException extends LlmException {

    public LlmResponseFormatException(String provider, String message) {
        super(provider, message);
    }

    public LlmResponseFormatException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }
}
