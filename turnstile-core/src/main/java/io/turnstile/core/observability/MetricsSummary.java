package io.turnstile.core.observability;

public record MetricsSummary(
    int totalSessions,
    int totalTurns,
    int completedTurns,
    int failedTurns,
    int totalToolInvocations,
    int protocolViolations,
    double p50LatencyMs,
    double p95LatencyMs
) {
}
