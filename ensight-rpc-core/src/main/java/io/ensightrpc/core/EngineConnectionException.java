package io.ensightrpc.core;

import java.io.IOException;

/**
 * Transport-level failure: the engine is unreachable, or the channel dropped mid-call.
 *
 * <p>Never retried inside a single call; retry is a caller concern.
 */
public class EngineConnectionException extends IOException {

    public EngineConnectionException(String message) {
        super(message);
    }

    public EngineConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static EngineConnectionException dropped(Throwable cause) {
        return new EngineConnectionException(Protocol.MSG_CONNECTION_DROPPED, cause);
    }

    public static EngineConnectionException notConnected(String host, int port) {
        return new EngineConnectionException("Not connected to " + host + ":" + port);
    }
}
