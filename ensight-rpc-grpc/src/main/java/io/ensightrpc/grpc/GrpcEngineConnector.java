package io.ensightrpc.grpc;

import io.ensightrpc.core.transport.EngineConnector;
import io.ensightrpc.core.transport.EngineTransport;
import io.grpc.ConnectivityState;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Opens plaintext gRPC channels to an engine and waits for them to become ready.
 */
public final class GrpcEngineConnector implements EngineConnector {

    private static final Logger log = LoggerFactory.getLogger(GrpcEngineConnector.class);

    /**
     * Creates the (not yet connected) channel for an address.
     */
    @FunctionalInterface
    public interface ChannelFactory {
        ManagedChannel open(String host, int port);
    }

    private final ChannelFactory channels;

    /**
     * Creates a connector using plaintext channels with unlimited inbound message size.
     */
    public GrpcEngineConnector() {
        this((host, port) -> ManagedChannelBuilder.forAddress(host, port)
                .usePlaintext()
                .maxInboundMessageSize(Integer.MAX_VALUE)
                .build());
    }

    /**
     * Creates a connector with a custom channel factory (TLS, in-process, ...).
     *
     * @param channels the factory to use
     */
    public GrpcEngineConnector(ChannelFactory channels) {
        this.channels = Objects.requireNonNull(channels, "channels");
    }

    @Override
    public Optional<EngineTransport> connect(String host, int port, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        ManagedChannel channel = channels.open(host, port);
        if (awaitReady(channel, timeout)) {
            log.debug("Channel to {}:{} is ready", host, port);
            return Optional.of(new GrpcEngineTransport(channel));
        }
        log.debug("Channel to {}:{} not ready within {}", host, port, timeout);
        channel.shutdownNow();
        return Optional.empty();
    }

    static boolean awaitReady(ManagedChannel channel, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        ConnectivityState state = channel.getState(true);
        while (state != ConnectivityState.READY) {
            if (state == ConnectivityState.SHUTDOWN) {
                return false;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            CountDownLatch changed = new CountDownLatch(1);
            channel.notifyWhenStateChanged(state, changed::countDown);
            try {
                if (!changed.await(remaining, TimeUnit.NANOSECONDS)) {
                    return false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            state = channel.getState(true);
        }
        return true;
    }
}
