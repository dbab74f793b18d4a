package com.deepansh.assistant.exception;

/**
 * Base unchecked exception for failures that prevent a turn from completing.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
