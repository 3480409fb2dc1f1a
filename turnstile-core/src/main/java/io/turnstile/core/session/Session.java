package io.turnstile.core.session;

import io.turnstile.core.model.ChatMessage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Conversation state for one session identifier. The message sequence and the turn counter may
 * only be changed by the thread holding {@link #lock()}.
 */
public final class Session {
    private final String id;
    private final Instant createdAt;
    private final List<ChatMessage> messages;
    private final ReentrantLock lock;
    private int completedTurns;

    Session(String id, Instant createdAt, String systemPrompt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.messages = new ArrayList<>();
        this.lock = new ReentrantLock();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(ChatMessage.system(systemPrompt));
        }
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public List<ChatMessage> messages() {
        return List.copyOf(messages);
    }

    public int size() {
        return messages.size();
    }

    /**
     * Number of turns that reached completion. The next turn's index.
     */
    public int completedTurns() {
        return completedTurns;
    }

    public void recordCompletedTurn() {
        requireOwner();
        completedTurns++;
    }

    List<ChatMessage> mutableMessages() {
        requireOwner();
        return messages;
    }

    private void requireOwner() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Session " + id + " must be locked before it is modified");
        }
    }
}
