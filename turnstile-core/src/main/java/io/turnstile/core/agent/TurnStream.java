package io.turnstile.core.agent;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded channel between the turn producer and its consumer. The producer blocks while the
 * buffer is full. A consumer that stops reading calls {@link #cancel()} (or {@link #close()}),
 * which the producer observes on its next emit.
 */
public final class TurnStream implements Iterable<TurnEvent>, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TurnStream.class);
    private static final long OFFER_INTERVAL_MS = 25;

    private final String sessionId;
    private final BlockingQueue<TurnEvent> queue;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile boolean textEmitted;
    private volatile boolean terminalTaken;

    TurnStream(String sessionId, int capacity) {
        this.sessionId = sessionId;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    public String sessionId() {
        return sessionId;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            queue.clear();
            LOG.debug("Turn stream for session {} cancelled by consumer", sessionId);
        }
    }

    /**
     * Cancels the turn unless its terminal event has already been consumed.
     */
    @Override
    public void close() {
        if (!terminalTaken) {
            cancel();
        }
    }

    public TurnEvent take() throws InterruptedException {
        return observe(queue.take());
    }

    public Optional<TurnEvent> poll(Duration timeout) throws InterruptedException {
        TurnEvent event = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return Optional.ofNullable(event).map(this::observe);
    }

    /**
     * Drains the stream and returns its terminal event.
     */
    public TurnEvent awaitTerminal() throws InterruptedException {
        while (true) {
            TurnEvent event = take();
            if (event.terminal()) {
                return event;
            }
        }
    }

    /**
     * Iterates events up to and including the terminal one. Interrupting the consuming thread
     * cancels the turn.
     */
    @Override
    public Iterator<TurnEvent> iterator() {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return !terminalTaken && !cancelled.get();
            }

            @Override
            public TurnEvent next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                try {
                    return take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancel();
                    throw new CancellationException("interrupted while waiting for turn events");
                }
            }
        };
    }

    void emit(TurnEvent event) {
        while (true) {
            checkCancelled();
            try {
                if (queue.offer(event, OFFER_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                    // cancel() may have freed the slot this offer just took
                    if (cancelled.get()) {
                        queue.remove(event);
                        throw new CancellationException("turn cancelled by caller");
                    }
                    if (event instanceof TurnEvent.TextDelta) {
                        textEmitted = true;
                    }
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("interrupted while streaming");
            }
        }
    }

    /**
     * Delivers the terminal event unless the consumer has gone away.
     */
    void finish(TurnEvent terminal) {
        try {
            emit(terminal);
        } catch (CancellationException e) {
            LOG.debug("Dropped terminal event for session {}: {}", sessionId, e.getMessage());
        }
    }

    void checkCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("turn cancelled by caller");
        }
    }

    boolean textEmitted() {
        return textEmitted;
    }

    private TurnEvent observe(TurnEvent event) {
        if (event.terminal()) {
            terminalTaken = true;
        }
        return event;
    }
}
