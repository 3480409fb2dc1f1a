package io.turnstile.core.session;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide map from session identifier to session. Sessions are created on first use and are
 * only removed on explicit request.
 */
public final class SessionRegistry {
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final String systemPrompt;

    public SessionRegistry(Clock clock, String systemPrompt) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.systemPrompt = systemPrompt == null ? "" : systemPrompt;
    }

    public Session getOrCreate(String sessionId) {
        String id = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId.trim();
        return sessions.computeIfAbsent(id, key -> new Session(key, clock.instant(), systemPrompt));
    }

    public Optional<Session> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId.trim()));
    }

    public boolean remove(String sessionId) {
        return sessionId != null && sessions.remove(sessionId.trim()) != null;
    }

    public int size() {
        return sessions.size();
    }
}
