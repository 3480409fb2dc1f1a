package io.turnstile.core.session;

import io.turnstile.core.model.ChatMessage;
import io.turnstile.core.model.MessageRole;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the ordered message sequence of a session. A leading system message is never evicted and
 * at least one non-system message always survives truncation.
 */
public final class HistoryManager {
    private static final Logger LOG = LoggerFactory.getLogger(HistoryManager.class);

    public void append(Session session, ChatMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        session.mutableMessages().add(message);
    }

    /**
     * Removes the oldest non-system messages until the history fits {@code maxLength}. Tool
     * results left at the head without the request that produced them are dropped as well.
     *
     * @return number of messages removed
     */
    public int truncate(Session session, int maxLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        List<ChatMessage> messages = session.mutableMessages();
        int start = hasSystemMessage(messages) ? 1 : 0;
        int nonSystem = messages.size() - start;
        int allowed = Math.max(1, maxLength - start);
        int excess = nonSystem - allowed;
        int removed = 0;
        if (excess > 0) {
            messages.subList(start, start + excess).clear();
            removed = excess;
        }
        while (messages.size() - start > 1 && messages.get(start).role() == MessageRole.TOOL) {
            messages.remove(start);
            removed++;
        }
        if (removed > 0) {
            LOG.debug("Truncated {} messages from session {} (bound {})", removed, session.id(), maxLength);
        }
        return removed;
    }

    public HistoryCheckpoint checkpoint(Session session) {
        return new HistoryCheckpoint(session.mutableMessages());
    }

    public void rollback(Session session, HistoryCheckpoint checkpoint) {
        List<ChatMessage> messages = session.mutableMessages();
        messages.clear();
        messages.addAll(checkpoint.messages());
    }

    /**
     * Smallest history bound that still leaves room for one message beside the system prompt.
     */
    public static int minimumBound(boolean withSystemMessage) {
        return withSystemMessage ? 2 : 1;
    }

    private static boolean hasSystemMessage(List<ChatMessage> messages) {
        return !messages.isEmpty() && messages.get(0).role() == MessageRole.SYSTEM;
    }
}
