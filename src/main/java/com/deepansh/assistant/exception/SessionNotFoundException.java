package com.deepansh.assistant.exception;

public class SessionNotFoundException extends AgentException {

    public SessionNotFoundException(String sessionId) {
        super("Unknown session: " + sessionId);
    }
}
