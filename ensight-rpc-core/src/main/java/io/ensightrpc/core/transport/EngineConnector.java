package io.ensightrpc.core.transport;

import java.time.Duration;
import java.util.Optional;

/**
 * Opens {@link EngineTransport}s.
 */
@FunctionalInterface
public interface EngineConnector {

    /**
     * Opens a transport to {@code host:port} and waits up to {@code timeout} for it to
     * become ready.
     *
     * <p>A timeout is not an error: the connector releases whatever it opened and returns
     * empty. Callers poll.
     *
     * @return the ready transport, or empty when it did not become ready in time
     */
    Optional<EngineTransport> connect(String host, int port, Duration timeout);
}
