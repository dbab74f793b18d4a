package com.deepansh.assistant.llm;

import lombok.Getter;

/**
 * Network failure or an error status from the provider.
 * Only retryable instances are retried by {@link com.deepansh.assistant.resilience.ResilientLlmClient}.
 */
@Getter
public class LlmTransportException extends LlmException {

    private final boolean retryable;

    public LlmTransportException(String provider, String message, boolean retryable) {
        super(provider, message);
        this.retryable = retryable;
    }

    public LlmTransportException(String provider, String message, boolean retryable, Throwable cause) {
        super(provider, message, cause);
        this.retryable = retryable;
    }
}
