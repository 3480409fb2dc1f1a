package io.turnstile.core.observability;

import java.time.Instant;
import java.util.List;

public record SessionMetrics(
    String sessionId,
    int turnCount,
    int completedTurns,
    int failedTurns,
    int toolInvocationCount,
    int violationCount,
    double averageLatencyMs,
    long totalLatencyMs,
    List<String> toolsUsed,
    Instant firstSeen,
    Instant lastSeen
) {
    public SessionMetrics {
        toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
    }
}
