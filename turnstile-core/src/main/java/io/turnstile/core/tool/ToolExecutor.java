package io.turnstile.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.turnstile.core.model.ToolCall;
import io.turnstile.core.model.ToolResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs tool invocation requests against the registry. Every outcome, including unknown tools,
 * missing arguments, exceptions and timeouts, comes back as a {@link ToolResult}; nothing a tool
 * does propagates to the caller.
 */
public final class ToolExecutor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ToolExecutor.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final long POLL_INTERVAL_MS = 25;
    private static final long NOT_STARTED = Long.MIN_VALUE;
    private static final int MAX_LOGGED_CHARS = 100;

    private final ToolRegistry registry;
    private final ExecutorService workers;

    public ToolExecutor(ToolRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.workers = Executors.newCachedThreadPool(new WorkerThreadFactory());
    }

    public ToolRegistry registry() {
        return registry;
    }

    /**
     * Executes one request on the calling thread.
     *
     * @param latestUserText most recent user-authored text of the session, used for fallback
     *                       argument recovery
     */
    public ToolResult execute(ToolCall call, String sessionId, String latestUserText) {
        Optional<Tool> resolved = registry.find(call.name());
        if (resolved.isEmpty()) {
            LOG.warn("Unknown tool '{}' requested in session {}", call.name(), sessionId);
            return ToolResult.failure(call.id(), call.name(), "Tool '" + call.name() + "' not found");
        }
        Tool tool = resolved.get();
        Map<String, Object> arguments = recoverArguments(tool, call.arguments(), latestUserText, sessionId);

        List<String> missing = missingArguments(tool, arguments);
        if (!missing.isEmpty()) {
            LOG.warn("Tool {} rejected: missing required arguments {}", tool.name(), missing);
            return ToolResult.failure(call.id(), tool.name(), "missing required argument(s): " + String.join(", ", missing));
        }

        long started = System.currentTimeMillis();
        LOG.info("[TOOL] {} | session {} | args {}", tool.name(), sessionId, abbreviate(toJson(arguments)));
        try {
            String output = tool.execute(arguments, new ToolContext(sessionId));
            LOG.debug("Tool {} finished in {} ms", tool.name(), System.currentTimeMillis() - started);
            return ToolResult.success(call.id(), tool.name(), output);
        } catch (RuntimeException ex) {
            LOG.warn("Tool {} failed after {} ms", tool.name(), System.currentTimeMillis() - started, ex);
            String error = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return ToolResult.failure(call.id(), tool.name(), error);
        }
    }

    /**
     * Executes all requests on the worker pool with at most {@code maxConcurrent} running at once
     * and returns one result per request, in request order.
     *
     * @throws CancellationException if {@code cancelled} turns true before every result is in;
     *                               pending executions are abandoned
     */
    public List<ToolResult> executeAll(
        List<ToolCall> calls,
        String sessionId,
        String latestUserText,
        Duration timeout,
        int maxConcurrent,
        BooleanSupplier cancelled
    ) {
        Semaphore permits = new Semaphore(Math.max(1, maxConcurrent));
        List<PendingCall> pending = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            AtomicLong startedAt = new AtomicLong(NOT_STARTED);
            Permit permit = new Permit(permits);
            Future<ToolResult> future = workers.submit(() -> {
                permits.acquire();
                try {
                    startedAt.set(System.nanoTime());
                    return execute(call, sessionId, latestUserText);
                } finally {
                    permit.release();
                }
            });
            pending.add(new PendingCall(call, future, startedAt, permit));
        }

        List<ToolResult> results = new ArrayList<>(pending.size());
        for (PendingCall next : pending) {
            results.add(await(next, pending, timeout, cancelled));
        }
        return List.copyOf(results);
    }

    private ToolResult await(PendingCall next, List<PendingCall> all, Duration timeout, BooleanSupplier cancelled) {
        while (true) {
            if (cancelled.getAsBoolean()) {
                abandon(all);
                throw new CancellationException("turn cancelled during tool execution");
            }
            try {
                return next.future().get(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                long started = next.startedAt().get();
                if (started != NOT_STARTED && System.nanoTime() - started > timeout.toNanos()) {
                    next.future().cancel(true);
                    // a tool that ignores the interrupt keeps running; queued requests must not wait on it
                    next.permit().release();
                    LOG.warn("Tool {} timed out after {} ms", next.call().name(), timeout.toMillis());
                    return ToolResult.failure(next.call().id(), next.call().name(),
                        "timed out after " + timeout.toMillis() + " ms");
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                LOG.warn("Tool {} aborted", next.call().name(), cause);
                return ToolResult.failure(next.call().id(), next.call().name(), String.valueOf(cause.getMessage()));
            } catch (CancellationException e) {
                return ToolResult.failure(next.call().id(), next.call().name(), "cancelled");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon(all);
                throw new CancellationException("interrupted during tool execution");
            }
        }
    }

    private void abandon(List<PendingCall> all) {
        for (PendingCall call : all) {
            call.future().cancel(true);
        }
    }

    private Map<String, Object> recoverArguments(
        Tool tool,
        Map<String, Object> arguments,
        String latestUserText,
        String sessionId
    ) {
        Optional<String> fallback = tool.fallbackArgument();
        if (fallback.isEmpty() || latestUserText == null || latestUserText.isBlank()) {
            return arguments;
        }
        String key = fallback.get();
        if (!isBlank(arguments.get(key))) {
            return arguments;
        }
        LOG.warn("[TOOL] {} called without '{}' in session {}, using latest user message", tool.name(), key, sessionId);
        Map<String, Object> recovered = new LinkedHashMap<>(arguments);
        recovered.put(key, latestUserText);
        return recovered;
    }

    private List<String> missingArguments(Tool tool, Map<String, Object> arguments) {
        return tool.requiredArguments().stream()
            .filter(name -> !arguments.containsKey(name) || arguments.get(name) == null)
            .toList();
    }

    private boolean isBlank(Object value) {
        return value == null || String.valueOf(value).isBlank();
    }

    private String toJson(Map<String, Object> arguments) {
        try {
            return JSON.writeValueAsString(arguments);
        } catch (Exception e) {
            return String.valueOf(arguments);
        }
    }

    private String abbreviate(String value) {
        if (value.length() <= MAX_LOGGED_CHARS) {
            return value;
        }
        return value.substring(0, MAX_LOGGED_CHARS) + "...";
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private record PendingCall(ToolCall call, Future<ToolResult> future, AtomicLong startedAt, Permit permit) {
    }

    /**
     * Returns a held permit exactly once, whether the execution finishes or is given up on.
     */
    private static final class Permit {
        private final Semaphore permits;
        private final AtomicBoolean released = new AtomicBoolean();

        Permit(Semaphore permits) {
            this.permits = permits;
        }

        void release() {
            if (released.compareAndSet(false, true)) {
                permits.release();
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "turnstile-tool-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
