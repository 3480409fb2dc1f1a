package io.turnstile.core.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time export of everything the monitor holds. {@code turns} holds the retained turn
 * records, oldest first.
 */
public record MetricsSnapshot(
    Instant exportedAt,
    Map<String, SessionMetrics> sessions,
    List<TurnRecord> turns,
    MetricsSummary summary
) {
    public MetricsSnapshot {
        exportedAt = exportedAt == null ? Instant.EPOCH : exportedAt;
        sessions = sessions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sessions));
        turns = turns == null ? List.of() : List.copyOf(turns);
    }
}
