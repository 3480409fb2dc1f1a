package io.turnstile.core.agent;

import io.turnstile.core.content.ResponseNormalizer;
import io.turnstile.core.model.ChatMessage;
import io.turnstile.core.model.ToolCall;
import io.turnstile.core.model.ToolResult;
import io.turnstile.core.observability.MetricsSnapshot;
import io.turnstile.core.observability.ProtocolClassification;
import io.turnstile.core.observability.ProtocolMonitor;
import io.turnstile.core.observability.SessionMetrics;
import io.turnstile.core.observability.TurnOutcome;
import io.turnstile.core.observability.TurnRecord;
import io.turnstile.core.provider.LlmProvider;
import io.turnstile.core.provider.LlmProviderException;
import io.turnstile.core.provider.LlmResponse;
import io.turnstile.core.provider.ProviderRouter;
import io.turnstile.core.session.HistoryCheckpoint;
import io.turnstile.core.session.HistoryManager;
import io.turnstile.core.session.Session;
import io.turnstile.core.session.SessionRegistry;
import io.turnstile.core.tool.ToolExecutor;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one user turn through the completion engine and any requested tools, streaming the
 * resulting text to the caller.
 *
 * <p>Turns run on a worker pool. Turns of the same session are serialized by the session lock;
 * turns of different sessions run concurrently. A turn that fails on an engine error, or that
 * the caller cancels before its final message is in place, leaves the session history exactly
 * as it was before the turn started.
 */
public final class TurnOrchestrator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TurnOrchestrator.class);
    private static final long LOCK_POLL_MS = 25;

    private final LlmProvider provider;
    private final ToolExecutor toolExecutor;
    private final ProtocolMonitor monitor;
    private final AgentSettings settings;
    private final Clock clock;
    private final SessionRegistry sessions;
    private final HistoryManager history;
    private final ExecutorService turnWorkers;

    public TurnOrchestrator(
        ProviderRouter providerRouter,
        ToolExecutor toolExecutor,
        ProtocolMonitor monitor,
        AgentSettings settings,
        Clock clock
    ) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.provider = providerRouter.resolve(settings.provider(), settings.model());
        this.toolExecutor = Objects.requireNonNull(toolExecutor, "toolExecutor must not be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sessions = new SessionRegistry(clock, settings.systemPrompt());
        this.history = new HistoryManager();
        this.turnWorkers = Executors.newCachedThreadPool(new TurnThreadFactory());
        LOG.debug("Using provider {} with model {}", provider.name(), settings.model());
    }

    /**
     * Starts a turn and returns the stream its events arrive on. A blank session id starts a new
     * session under a generated id, available from {@link TurnStream#sessionId()}.
     */
    public TurnStream submitTurn(String sessionId, String userText) {
        if (userText == null || userText.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        Session session = sessions.getOrCreate(sessionId);
        TurnStream stream = new TurnStream(session.id(), settings.streamBufferSize());
        turnWorkers.execute(() -> run(session, userText, stream));
        return stream;
    }

    /**
     * Runs a turn to its end and returns the terminal event.
     */
    public TurnEvent runTurn(String sessionId, String userText) throws InterruptedException {
        try (TurnStream stream = submitTurn(sessionId, userText)) {
            return stream.awaitTerminal();
        }
    }

    public Optional<SessionMetrics> getSessionMetrics(String sessionId) {
        return monitor.getSessionMetrics(sessionId);
    }

    public Map<String, SessionMetrics> getAllMetrics() {
        return monitor.getAllMetrics();
    }

    public MetricsSnapshot exportMetrics() {
        return monitor.exportMetrics();
    }

    /**
     * Forgets the session's history once any in-flight turn has finished. Metrics are kept.
     */
    public boolean deleteSession(String sessionId) {
        Optional<Session> session = sessions.find(sessionId);
        if (session.isEmpty()) {
            return false;
        }
        ReentrantLock lock = session.get().lock();
        lock.lock();
        try {
            return sessions.remove(sessionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of the session's current history, taken under the session lock.
     */
    public Optional<List<ChatMessage>> history(String sessionId) {
        return sessions.find(sessionId).map(session -> {
            session.lock().lock();
            try {
                return session.messages();
            } finally {
                session.lock().unlock();
            }
        });
    }

    public SessionRegistry sessions() {
        return sessions;
    }

    public AgentSettings settings() {
        return settings;
    }

    public String providerName() {
        return provider.name();
    }

    private void run(Session session, String userText, TurnStream stream) {
        ReentrantLock lock = session.lock();
        TurnEvent terminal;
        try {
            acquire(lock, stream);
        } catch (CancellationException e) {
            LOG.debug("Turn for session {} cancelled before it started", session.id());
            return;
        }
        try {
            terminal = runLocked(session, userText, stream);
        } finally {
            lock.unlock();
        }
        if (terminal != null) {
            stream.finish(terminal);
        }
    }

    private void acquire(ReentrantLock lock, TurnStream stream) {
        try {
            while (!lock.tryLock(LOCK_POLL_MS, TimeUnit.MILLISECONDS)) {
                stream.checkCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while waiting for session lock");
        }
    }

    /**
     * Truncates twice: before the first engine call so the request fits the bound, and after the
     * final assistant message so the stored history does too. Tool messages are never cut mid-turn.
     */
    private TurnEvent runLocked(Session session, String userText, TurnStream stream) {
        Turn turn = new Turn(session, stream, clock.instant(), System.nanoTime());
        HistoryCheckpoint checkpoint = history.checkpoint(session);
        try {
            turn.moveTo(TurnState.GENERATING_FIRST);
            history.append(session, ChatMessage.user(userText));
            history.truncate(session, settings.maxHistoryMessages());
            stream.checkCancelled();

            LlmResponse first = requestCompletion(session);
            stream.checkCancelled();
            List<ToolCall> calls = validate(first.toolCalls());
            String leading = ResponseNormalizer.leadingText(first.content());
            turn.askedQuestion = ProtocolMonitor.containsQuestion(leading);
            turn.clarificationQuestion = ProtocolMonitor.clarificationQuestion(leading).orElse("");

            if (calls.isEmpty()) {
                turn.moveTo(TurnState.DIRECT);
                String text = ResponseNormalizer.extractText(first.content());
                history.append(session, ChatMessage.assistant(first.content()));
                history.truncate(session, settings.maxHistoryMessages());
                turn.moveTo(TurnState.STREAMING);
                streamText(turn, text);
            } else {
                turn.moveTo(TurnState.TOOLS_REQUESTED);
                turn.calls = calls;
                history.append(session, ChatMessage.assistant(first.content()));
                streamText(turn, ResponseNormalizer.extractText(first.content()));
                for (ToolCall call : calls) {
                    stream.emit(TurnEvent.ToolCallRequested.of(call));
                }

                turn.moveTo(TurnState.EXECUTING_TOOLS);
                List<ToolResult> results = toolExecutor.executeAll(
                    calls,
                    session.id(),
                    userText,
                    settings.toolTimeout(),
                    settings.maxConcurrentTools(),
                    stream::isCancelled
                );
                stream.checkCancelled();
                requireCorrelated(calls, results);
                for (ToolResult result : results) {
                    history.append(session, ChatMessage.tool(result.content(), result.toolCallId()));
                }

                turn.moveTo(TurnState.GENERATING_FOLLOWUP);
                LlmResponse followUp = requestCompletion(session);
                stream.checkCancelled();
                if (followUp.hasToolCalls()) {
                    LOG.warn(
                        "Follow-up response for session {} requested {} more tool call(s); keeping its text only",
                        session.id(),
                        followUp.toolCalls().size()
                    );
                }
                String text = ResponseNormalizer.extractText(followUp.content());
                history.append(session, ChatMessage.assistant(text));
                history.truncate(session, settings.maxHistoryMessages());
                turn.moveTo(TurnState.STREAMING);
                streamText(turn, text);
            }
            return finishTurn(turn);
        } catch (LlmProviderException e) {
            history.rollback(session, checkpoint);
            turn.moveTo(TurnState.FAILED);
            String reason = e.getMessage() == null ? "completion engine failed" : e.getMessage();
            LOG.warn("Turn failed for session {} after {} ms: {}", session.id(), turn.elapsedMs(), reason);
            TurnRecord record = record(turn, TurnOutcome.FAILED, reason);
            monitor.record(record);
            return new TurnEvent.TurnFailed(session.id(), reason, stream.textEmitted());
        } catch (CancellationException e) {
            if (turn.state == TurnState.STREAMING) {
                LOG.debug("Turn for session {} cancelled while streaming; keeping its history", session.id());
                finishTurn(turn);
                return null;
            }
            history.rollback(session, checkpoint);
            LOG.debug("Turn for session {} cancelled in state {}; history rolled back", session.id(), turn.state);
            return null;
        } catch (RuntimeException e) {
            history.rollback(session, checkpoint);
            if (!turn.state.isTerminal()) {
                turn.moveTo(TurnState.FAILED);
            }
            LOG.error("Turn for session {} aborted unexpectedly", session.id(), e);
            monitor.record(record(turn, TurnOutcome.FAILED, String.valueOf(e.getMessage())));
            return new TurnEvent.TurnFailed(session.id(), "internal error", stream.textEmitted());
        }
    }

    private TurnEvent finishTurn(Turn turn) {
        turn.moveTo(TurnState.COMPLETE);
        turn.session.recordCompletedTurn();
        TurnRecord record = record(turn, TurnOutcome.COMPLETED, null);
        monitor.record(record);
        return new TurnEvent.TurnCompleted(turn.session.id(), turn.streamed.toString(), turn.calls, record);
    }

    private LlmResponse requestCompletion(Session session) {
        return provider.chat(settings.model(), session.messages(), toolExecutor.registry().toolDefinitions());
    }

    private List<ToolCall> validate(List<ToolCall> calls) {
        Set<String> seen = new HashSet<>();
        for (ToolCall call : calls) {
            if (call.name().isBlank()) {
                throw new LlmProviderException(provider.name(), "tool request without a name");
            }
            if (call.id().isBlank()) {
                throw new LlmProviderException(provider.name(), "tool request '" + call.name() + "' has no correlation id");
            }
            if (!seen.add(call.id())) {
                throw new LlmProviderException(provider.name(), "duplicate tool correlation id '" + call.id() + "'");
            }
        }
        return calls;
    }

    private void requireCorrelated(List<ToolCall> calls, List<ToolResult> results) {
        if (results.size() != calls.size()) {
            throw new IllegalStateException(
                "expected " + calls.size() + " tool results but got " + results.size());
        }
        for (int i = 0; i < calls.size(); i++) {
            if (!calls.get(i).id().equals(results.get(i).toolCallId())) {
                throw new IllegalStateException("tool result " + i + " does not answer request " + calls.get(i).id());
            }
        }
    }

    private void streamText(Turn turn, String text) {
        int chunk = settings.streamChunkSize();
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(text.length(), start + chunk);
            if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
                end++;
            }
            String fragment = text.substring(start, end);
            turn.stream.emit(new TurnEvent.TextDelta(fragment));
            turn.streamed.append(fragment);
            start = end;
        }
    }

    /**
     * Failed turns are not classified: they leave no history, so the retry is still the opening
     * turn and is the one judged.
     */
    private TurnRecord record(Turn turn, TurnOutcome outcome, String failureReason) {
        int turnIndex = turn.index;
        int toolCount = turn.calls.size();
        ProtocolClassification classification = outcome == TurnOutcome.FAILED
            ? ProtocolClassification.COMPLIANT
            : ProtocolMonitor.classify(turnIndex, turn.askedQuestion, toolCount);
        return new TurnRecord(
            turn.session.id(),
            turn.startedAt,
            turnIndex,
            toolCount,
            turn.calls.stream().map(ToolCall::name).distinct().toList(),
            turn.askedQuestion,
            turn.clarificationQuestion,
            turn.elapsedMs(),
            outcome,
            classification,
            failureReason
        );
    }

    @Override
    public void close() {
        turnWorkers.shutdownNow();
    }

    /**
     * Mutable progress of the turn currently running on this thread.
     */
    private static final class Turn {
        private final Session session;
        private final TurnStream stream;
        private final Instant startedAt;
        private final long startedNanos;
        private final int index;
        private final StringBuilder streamed = new StringBuilder();
        private TurnState state = TurnState.AWAITING_INPUT;
        private List<ToolCall> calls = List.of();
        private boolean askedQuestion;
        private String clarificationQuestion = "";

        private Turn(Session session, TurnStream stream, Instant startedAt, long startedNanos) {
            this.session = session;
            this.stream = stream;
            this.startedAt = startedAt;
            this.startedNanos = startedNanos;
            this.index = session.completedTurns();
        }

        private void moveTo(TurnState next) {
            if (!state.canMoveTo(next)) {
                throw new IllegalStateException("illegal turn transition " + state + " -> " + next);
            }
            LOG.debug("Session {} turn {}: {} -> {}", session.id(), index, state, next);
            state = next;
        }

        private long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        }
    }

    private static final class TurnThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "turnstile-turn-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
