package io.ensightrpc.client.event;

import io.ensightrpc.client.EngineChannel;
import io.ensightrpc.core.EngineConnectionException;
import io.ensightrpc.core.transport.EventSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * The engine's event stream, read by one daemon thread.
 *
 * <p>Each event goes to the listener when one is set, otherwise to an unbounded FIFO queue
 * drained by {@link #poll()}. Enabling is idempotent while the stream is starting or active.
 */
public final class EventStream implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventStream.class);

    private final EngineChannel channel;
    private final Duration connectTimeout;
    private final String prefix;
    private final Queue<String> queue = new ConcurrentLinkedQueue<>();
    private final Object lock = new Object();

    private StreamState state = StreamState.IDLE;
    private EventSubscription subscription;
    private volatile EventCallback listener;

    public EventStream(EngineChannel channel, Duration connectTimeout, String prefix) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    /**
     * Opens the stream and starts the reader thread, unless already starting or active.
     *
     * @throws EngineConnectionException if the stream cannot be opened; the state becomes
     *         {@link StreamState#BROKEN}
     */
    public void enable() throws EngineConnectionException {
        synchronized (lock) {
            if (state == StreamState.STARTING || state == StreamState.ACTIVE) return;
            state = StreamState.STARTING;
        }

        EventSubscription sub;
        try {
            sub = channel.ensureConnected(connectTimeout).openEventStream(prefix, channel.metadata());
        } catch (EngineConnectionException | RuntimeException e) {
            synchronized (lock) {
                if (state == StreamState.STARTING) state = StreamState.BROKEN;
            }
            throw e;
        }

        synchronized (lock) {
            if (state != StreamState.STARTING) {
                // closed while opening
                sub.close();
                return;
            }
            subscription = sub;
            state = StreamState.ACTIVE;
        }
        Thread t = new Thread(() -> run(sub), "ensight-events");
        t.setDaemon(true);
        t.start();
        log.info("Event stream enabled with prefix {}", prefix);
    }

    private void run(EventSubscription sub) {
        try {
            String event;
            while ((event = sub.next()) != null) {
                deliver(event);
            }
            finish(sub, StreamState.CLOSED, null);
        } catch (IOException | RuntimeException e) {
            finish(sub, StreamState.BROKEN, e);
        }
    }

    private void deliver(String event) {
        EventCallback l = listener;
        if (l == null) {
            queue.add(event);
            return;
        }
        try {
            l.onEvent(event);
        } catch (RuntimeException e) {
            log.error("Event listener failed for {}", event, e);
        }
    }

    private void finish(EventSubscription sub, StreamState terminal, Exception cause) {
        synchronized (lock) {
            if (subscription != sub) {
                log.debug("Event reader stopped after close");
                return;
            }
            subscription = null;
            state = terminal;
        }
        sub.close();
        if (cause != null) {
            log.warn("Event stream broken", cause);
        } else {
            log.info("Event stream ended by engine");
        }
    }

    /**
     * @return the oldest undelivered event, if any
     */
    public Optional<String> poll() {
        return Optional.ofNullable(queue.poll());
    }

    public int pending() {
        return queue.size();
    }

    /**
     * Routes subsequent events to {@code listener} instead of the queue; {@code null} restores
     * queueing. Events already queued stay queued.
     */
    public void setListener(EventCallback listener) {
        this.listener = listener;
    }

    public boolean isEnabled() {
        synchronized (lock) {
            return state == StreamState.STARTING || state == StreamState.ACTIVE;
        }
    }

    public StreamState state() {
        synchronized (lock) {
            return state;
        }
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Cancels the stream and lets the reader thread end. Idempotent.
     */
    @Override
    public void close() {
        EventSubscription sub;
        synchronized (lock) {
            sub = subscription;
            subscription = null;
            if (state == StreamState.STARTING || state == StreamState.ACTIVE) {
                state = StreamState.CLOSED;
            }
        }
        if (sub != null) {
            sub.close();
            log.info("Event stream closed");
        }
    }
}
