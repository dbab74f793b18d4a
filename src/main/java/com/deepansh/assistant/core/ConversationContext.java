package com.deepansh.assistant.core;

import com.deepansh.assistant.model.Message;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered message log of one conversation.
 *
 * The first message is always the system prompt. Everything else is appended;
 * {@link #reset()} truncates back to the system message and bumps the epoch so
 * that a turn still in flight can tell its pending appends are stale.
 *
 * All methods are thread-safe. {@link #turnLock()} serializes turns on the same
 * conversation; reset does not take it, so a reset can interrupt a running turn.
 */
public class ConversationContext {

    private final String sessionId;
    private final List<Message> messages = new ArrayList<>();
    private final Map<String, Object> metadata = new ConcurrentHashMap<>();
    private final ReentrantLock turnLock = new ReentrantLock();
    private final Instant createdAt = Instant.now();

    private volatile String provider;
    private long epoch;

    public ConversationContext(String sessionId, String systemPrompt) {
        this.sessionId = sessionId;
        this.messages.add(Message.system(systemPrompt));
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /** Provider id preferred by this conversation; null means the default provider. */
    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    ReentrantLock turnLock() {
        return turnLock;
    }

    public synchronized long epoch() {
        return epoch;
    }

    public synchronized String getSystemPrompt() {
        return messages.get(0).getContent();
    }

    public synchronized void append(Message message) {
        requireNonSystem(message);
        messages.add(message);
    }

    /**
     * Appends only if no reset happened since {@code expectedEpoch} was read.
     *
     * @return false when the message was discarded
     */
    public synchronized boolean appendIfCurrent(long expectedEpoch, Message message) {
        requireNonSystem(message);
        if (epoch != expectedEpoch) {
            return false;
        }
        messages.add(message);
        return true;
    }

    /** Snapshot of every message, system prompt first. */
    public synchronized List<Message> messages() {
        return Collections.unmodifiableList(new ArrayList<>(messages));
    }

    /** Snapshot of the conversation without the system prompt. */
    public synchronized List<Message> history() {
        return Collections.unmodifiableList(new ArrayList<>(messages.subList(1, messages.size())));
    }

    /**
     * The last {@code limit} non-system messages. If the window would start on a
     * tool result, it is widened back to the assistant message that requested it.
     */
    public synchronized List<Message> recentNonSystem(int limit) {
        List<Message> nonSystem = messages.subList(1, messages.size());
        int start = Math.max(0, nonSystem.size() - Math.max(0, limit));
        while (start > 0 && start < nonSystem.size()
                && nonSystem.get(start).getRole() == Message.Role.tool) {
            start--;
        }
        return new ArrayList<>(nonSystem.subList(start, nonSystem.size()));
    }

    public synchronized int size() {
        return messages.size();
    }

    /** Drops everything but the system prompt. */
    public synchronized void reset() {
        Message system = messages.get(0);
        messages.clear();
        messages.add(system);
        epoch++;
    }

    private static void requireNonSystem(Message message) {
        if (message.getRole() == Message.Role.system) {
            throw new IllegalArgumentException("the system prompt is fixed at construction");
        }
    }
}
