package io.ensightrpc.client;

import io.ensightrpc.core.CommandResult;
import io.ensightrpc.core.EngineConnectionException;
import io.ensightrpc.core.EnsightRpcException;
import io.ensightrpc.core.ExecMode;
import io.ensightrpc.core.transport.EngineTransport;
import io.ensightrpc.core.transport.PythonReply;
import io.ensightrpc.core.transport.RenderOptions;

import java.time.Duration;
import java.util.Objects;

/**
 * Sends commands, render requests and geometry requests over an {@link EngineChannel},
 * connecting on demand. Nothing is retried here.
 */
public final class CommandExecutor {
    private final EngineChannel channel;
    private final Duration connectTimeout;

    public CommandExecutor(EngineChannel channel, Duration connectTimeout) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    /**
     * @throws EnsightRpcException.RemoteExecutionFailed if the engine reports a negative error
     * @throws EngineConnectionException if no connection can be made or the call drops
     */
    public CommandResult execute(String command, ExecMode mode) throws EngineConnectionException {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(mode, "mode");
        EngineTransport t = channel.ensureConnected(connectTimeout);
        PythonReply reply = t.runPython(mode, command, channel.metadata());
        if (reply.failed()) {
            throw new EnsightRpcException.RemoteExecutionFailed();
        }
        return CommandResult.of(mode, reply.value());
    }

    /**
     * @return encoded image bytes, PNG unless {@code options} ask for raw RGB
     */
    public byte[] render(RenderOptions options) throws EngineConnectionException {
        Objects.requireNonNull(options, "options");
        return channel.ensureConnected(connectTimeout).renderImage(options, channel.metadata());
    }

    /**
     * @return the current scene as a binary glTF document
     */
    public byte[] geometry() throws EngineConnectionException {
        return channel.ensureConnected(connectTimeout).geometry(channel.metadata());
    }
}
