package com.deepansh.assistant.llm;

/**
 * Missing or rejected credentials, or an unknown provider. Never retried.
 */
public class LlmConfigurationException extends LlmException {

    public LlmConfigurationException(String provider, String message) {
        super(provider, message);
    }
}
