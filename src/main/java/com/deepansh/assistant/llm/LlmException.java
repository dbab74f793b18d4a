package com.deepansh.assistant.llm;

import com.deepansh.assistant.exception.AgentException;
import lombok.Getter;

/**
 * Failure talking to an LLM provider. Subclasses let callers tell
 * configuration problems, transport problems and malformed responses apart.
 */
@Getter
public abstract class LlmException extends AgentException {

    private final String provider;

    protected LlmException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    protected LlmException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
