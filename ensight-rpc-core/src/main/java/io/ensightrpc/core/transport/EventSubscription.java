package io.ensightrpc.core.transport;

import java.io.IOException;

/**
 * Blocking view of the engine's server-push event stream.
 */
public interface EventSubscription extends AutoCloseable {

    /**
     * Blocks until the next notification arrives.
     *
     * @return the notification string, or {@code null} when the engine ended the stream
     * @throws IOException if the stream failed or was closed locally
     */
    String next() throws IOException;

    /**
     * Cancels the stream. A thread blocked in {@link #next()} unblocks with an error.
     */
    @Override
    void close();
}
