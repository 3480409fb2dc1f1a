package io.turnstile.core.observability;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies turns against the ask-before-acting protocol and aggregates per-session metrics for
 * the lifetime of the process. Classification is advisory and never changes how a turn runs.
 */
public final class ProtocolMonitor {
    private static final Logger LOG = LoggerFactory.getLogger(ProtocolMonitor.class);
    static final int MAX_RECORDS = 20_000;

    private final Clock clock;
    private final Map<String, SessionTally> sessions = new TreeMap<>();
    private final Deque<TurnRecord> records = new ArrayDeque<>();

    public ProtocolMonitor(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Only a session's opening turn is bound by the protocol. A question asked in the same
     * response that already requests tools is PARTIAL: the agent asked but did not wait.
     */
    public static ProtocolClassification classify(int turnIndex, boolean askedQuestion, int toolInvocationCount) {
        if (turnIndex > 0 || toolInvocationCount <= 0) {
            return ProtocolClassification.COMPLIANT;
        }
        return askedQuestion ? ProtocolClassification.PARTIAL : ProtocolClassification.VIOLATED;
    }

    public static boolean containsQuestion(String text) {
        return text != null && text.contains("?");
    }

    /**
     * First line of {@code text} containing a question mark, trimmed.
     */
    public static Optional<String> clarificationQuestion(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return text.lines()
            .map(String::trim)
            .filter(line -> line.contains("?"))
            .findFirst();
    }

    public synchronized SessionMetrics record(TurnRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        records.addLast(record);
        while (records.size() > MAX_RECORDS) {
            records.removeFirst();
        }
        SessionTally tally = sessions.computeIfAbsent(record.sessionId(), SessionTally::new);
        tally.add(record);

        LOG.info(
            "[METRICS] session {} | turn {} | {} | tools {} | asked {} | {} | {} ms",
            record.sessionId(),
            record.turnIndex(),
            record.outcome(),
            record.toolInvocationCount(),
            record.askedQuestion(),
            record.classification(),
            record.latencyMs()
        );
        if (record.classification().isViolation()) {
            LOG.warn(
                "[PROTOCOL] {} in session {}: {} tool call(s) {} on the opening turn",
                record.classification(),
                record.sessionId(),
                record.toolInvocationCount(),
                record.askedQuestion() ? "issued alongside a question" : "issued without a clarifying question"
            );
        }
        return tally.snapshot();
    }

    public synchronized Optional<SessionMetrics> getSessionMetrics(String sessionId) {
        SessionTally tally = sessions.get(sessionId);
        return tally == null ? Optional.empty() : Optional.of(tally.snapshot());
    }

    public synchronized Map<String, SessionMetrics> getAllMetrics() {
        Map<String, SessionMetrics> all = new LinkedHashMap<>();
        sessions.forEach((id, tally) -> all.put(id, tally.snapshot()));
        return all;
    }

    public synchronized List<TurnRecord> records() {
        return List.copyOf(records);
    }

    public synchronized MetricsSummary summary() {
        int turns = 0;
        int completed = 0;
        int failed = 0;
        int tools = 0;
        int violations = 0;
        for (SessionTally tally : sessions.values()) {
            turns += tally.turnCount;
            completed += tally.completedTurns;
            failed += tally.failedTurns;
            tools += tally.toolInvocations;
            violations += tally.violations;
        }
        List<Double> latencies = records.stream()
            .map(record -> (double) record.latencyMs())
            .sorted()
            .toList();
        return new MetricsSummary(
            sessions.size(),
            turns,
            completed,
            failed,
            tools,
            violations,
            round2(percentile(latencies, 50)),
            round2(percentile(latencies, 95))
        );
    }

    public synchronized MetricsSnapshot exportMetrics() {
        return new MetricsSnapshot(clock.instant(), getAllMetrics(), records(), summary());
    }

    private double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int safe = Math.max(0, Math.min(100, percentile));
        if (safe == 0) {
            return sorted.get(0);
        }
        int index = (int) Math.ceil((safe / 100.0) * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static final class SessionTally {
        private final String sessionId;
        private final TreeSet<String> toolsUsed = new TreeSet<>();
        private int turnCount;
        private int completedTurns;
        private int failedTurns;
        private int toolInvocations;
        private int violations;
        private long totalLatencyMs;
        private Instant firstSeen;
        private Instant lastSeen;

        private SessionTally(String sessionId) {
            this.sessionId = sessionId;
        }

        private void add(TurnRecord record) {
            turnCount++;
            if (record.completed()) {
                completedTurns++;
            } else {
                failedTurns++;
            }
            toolInvocations += record.toolInvocationCount();
            if (record.classification().isViolation()) {
                violations++;
            }
            totalLatencyMs += Math.max(0, record.latencyMs());
            toolsUsed.addAll(record.toolsUsed());
            if (firstSeen == null || record.timestamp().isBefore(firstSeen)) {
                firstSeen = record.timestamp();
            }
            if (lastSeen == null || record.timestamp().isAfter(lastSeen)) {
                lastSeen = record.timestamp();
            }
        }

        private SessionMetrics snapshot() {
            double average = turnCount == 0 ? 0.0 : Math.round(totalLatencyMs * 100.0 / turnCount) / 100.0;
            return new SessionMetrics(
                sessionId,
                turnCount,
                completedTurns,
                failedTurns,
                toolInvocations,
                violations,
                average,
                totalLatencyMs,
                new ArrayList<>(toolsUsed),
                firstSeen,
                lastSeen
            );
        }
    }
}
