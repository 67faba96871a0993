package io.ensightrpc.client;

import io.ensightrpc.core.EngineConnectionException;
import io.ensightrpc.core.Protocol;
import io.ensightrpc.core.transport.EngineConnector;
import io.ensightrpc.core.transport.EngineTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the single transport to one engine.
 *
 * <p>Connected exactly when a transport is held. All methods are safe to call from the
 * event thread and the caller's thread at once.
 */
public final class EngineChannel {
    private static final Logger log = LoggerFactory.getLogger(EngineChannel.class);

    private final String host;
    private final int port;
    private final EngineConnector connector;
    private volatile String secretKey;
    private EngineTransport transport;

    public EngineChannel(String host, int port, String secretKey, EngineConnector connector) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.secretKey = secretKey == null ? "" : secretKey;
        this.connector = Objects.requireNonNull(connector, "connector");
    }

    /**
     * Makes one connection attempt if not already connected. A failed attempt leaves the
     * channel disconnected and raises nothing.
     */
    public synchronized void connect(Duration timeout) {
        if (transport != null) return;
        Optional<EngineTransport> t = connector.connect(host, port, timeout);
        if (t.isPresent()) {
            transport = t.get();
            log.debug("Connected to {}:{}", host, port);
        } else {
            log.debug("No connection to {}:{} within {}", host, port, timeout);
        }
    }

    public synchronized boolean isConnected() {
        return transport != null;
    }

    /**
     * @return the live transport
     * @throws EngineConnectionException if not connected
     */
    public synchronized EngineTransport transport() throws EngineConnectionException {
        if (transport == null) throw EngineConnectionException.notConnected(host, port);
        return transport;
    }

    /**
     * Connects on demand, then returns the live transport.
     */
    public EngineTransport ensureConnected(Duration timeout) throws EngineConnectionException {
        connect(timeout);
        return transport();
    }

    /**
     * Releases the transport, first asking the engine to exit when {@code stopRemote} is set.
     * Does nothing when not connected.
     */
    public synchronized void shutdown(boolean stopRemote) {
        if (transport == null) return;
        EngineTransport t = transport;
        transport = null;
        try {
            if (stopRemote) {
                t.exit(metadata());
            }
        } catch (EngineConnectionException e) {
            log.warn("Exit request to {}:{} failed", host, port, e);
        } finally {
            t.close();
            log.debug("Disconnected from {}:{}", host, port);
        }
    }

    /**
     * Metadata attached to every call: the shared secret when one is set, otherwise nothing.
     */
    public Map<String, String> metadata() {
        String s = secretKey;
        return s.isEmpty() ? Map.of() : Map.of(Protocol.MD_SHARED_SECRET, s);
    }

    public void setSecretKey(String secretKey) {
        this.secretKey = secretKey == null ? "" : secretKey;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }
}
