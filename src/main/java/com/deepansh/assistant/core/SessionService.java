package com.deepansh.assistant.core;

import com.deepansh.assistant.config.AgentProperties;
import com.deepansh.assistant.exception.SessionNotFoundException;
import com.deepansh.assistant.model.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process registry of live conversations, keyed by session id.
 * Conversations do not survive a restart.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionService {

    private final AgentProperties properties;
    private final Map<String, ConversationContext> sessions = new ConcurrentHashMap<>();

    /** Returns the named conversation, creating it (with a fresh id when blank) if needed. */
    public ConversationContext getOrCreate(String sessionId) {
        String id = (sessionId != null && !sessionId.isBlank()) ? sessionId : UUID.randomUUID().toString();
        return sessions.computeIfAbsent(id, key -> {
            log.info("Started session [{}]", key);
            return new ConversationContext(key, properties.getSystemPrompt());
        });
    }

    public Optional<ConversationContext> find(String sessionId) {
        return Optional.ofNullable(sessionId).map(sessions::get);
    }

    public ConversationContext require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public void reset(String sessionId) {
        require(sessionId).reset();
        log.info("Reset session [{}]", sessionId);
    }

    public List<Message> history(String sessionId) {
        return require(sessionId).history();
    }

    public boolean delete(String sessionId) {
        boolean removed = sessionId != null && sessions.remove(sessionId) != null;
        if (removed) {
            log.info("Deleted session [{}]", sessionId);
        }
        return removed;
    }

    public Set<String> sessionIds() {
        return Set.copyOf(sessions.keySet());
    }
}
