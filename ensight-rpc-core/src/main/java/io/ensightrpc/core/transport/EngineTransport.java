package io.ensightrpc.core.transport;

import io.ensightrpc.core.EngineConnectionException;
import io.ensightrpc.core.ExecMode;

import java.util.Map;

/**
 * A live connection to one engine.
 *
 * <p>Every method blocks until the engine replies or the connection fails. Transport
 * failures surface as {@link EngineConnectionException}; calls are never retried here.
 * After {@link #close()} any further call fails fast, and any open
 * {@link EventSubscription} unblocks with an error.
 */
public interface EngineTransport extends AutoCloseable {

    /**
     * Runs a command string in the engine interpreter.
     *
     * @param mode how the command is executed and what comes back
     * @param command the command text
     * @param metadata per-call metadata, possibly empty
     * @return the raw reply; a negative {@link PythonReply#error()} flags a remote failure
     */
    PythonReply runPython(ExecMode mode, String command, Map<String, String> metadata) throws EngineConnectionException;

    /**
     * Renders the current scene.
     *
     * @return PNG bytes, or raw RGB bytes ({@code width * height * 3}) when PNG was not requested
     */
    byte[] renderImage(RenderOptions options, Map<String, String> metadata) throws EngineConnectionException;

    /**
     * @return the current scene geometry as a binary glTF (GLB) container
     */
    byte[] geometry(Map<String, String> metadata) throws EngineConnectionException;

    /**
     * Asks the engine process to terminate.
     */
    void exit(Map<String, String> metadata) throws EngineConnectionException;

    /**
     * Opens the server-push event stream.
     *
     * @param prefix session-unique URL prefix the engine prepends to every notification
     * @return a blocking subscription; the caller owns it and must close it
     */
    EventSubscription openEventStream(String prefix, Map<String, String> metadata) throws EngineConnectionException;

    /**
     * Releases the connection. Idempotent.
     */
    @Override
    void close();
}
