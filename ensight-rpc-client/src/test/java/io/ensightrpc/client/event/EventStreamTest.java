package io.ensightrpc.client.event;

import io.ensightrpc.client.EngineChannel;
import io.ensightrpc.client.FakeEngine;
import io.ensightrpc.core.EngineConnectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventStreamTest {

    private FakeEngine engine;
    private EngineChannel channel;
    private EventStream stream;

    @BeforeEach
    void setUp() {
        engine = new FakeEngine();
        channel = new EngineChannel("127.0.0.1", 12345, "", engine);
        stream = new EventStream(channel, Duration.ofSeconds(1), "grpc://s1/");
    }

    @AfterEach
    void tearDown() {
        stream.close();
        channel.shutdown(false);
    }

    static void eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) throw new AssertionError("condition not met within 5s");
            Thread.sleep(10);
        }
    }

    @Test
    void enableIsIdempotent() throws Exception {
        stream.enable();
        stream.enable();
        stream.enable();

        assertThat(engine.streamPrefixes).containsExactly("grpc://s1/");
        assertThat(stream.isEnabled()).isTrue();
        assertThat(stream.state()).isEqualTo(StreamState.ACTIVE);
    }

    @Test
    void enableConnectsOnDemand() throws Exception {
        assertThat(channel.isConnected()).isFalse();

        stream.enable();

        assertThat(channel.isConnected()).isTrue();
    }

    @Test
    void queuedEventsComeOutInArrivalOrder() throws Exception {
        stream.enable();
        engine.push("grpc://s1/a");
        engine.push("grpc://s1/b");
        engine.push("grpc://s1/c");

        eventually(() -> stream.pending() == 3);

        assertThat(stream.poll()).contains("grpc://s1/a");
        assertThat(stream.poll()).contains("grpc://s1/b");
        assertThat(stream.poll()).contains("grpc://s1/c");
        assertThat(stream.poll()).isEmpty();
    }

    @Test
    void listenerReceivesEventsInsteadOfQueue() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        CountDownLatch two = new CountDownLatch(2);
        stream.setListener(url -> {
            seen.add(url);
            two.countDown();
        });
        stream.enable();

        engine.push("grpc://s1/x");
        engine.push("grpc://s1/y");

        assertThat(two.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen).containsExactly("grpc://s1/x", "grpc://s1/y");
        assertThat(stream.pending()).isZero();
    }

    @Test
    void failingListenerDoesNotStopTheReader() throws Exception {
        CountDownLatch second = new CountDownLatch(1);
        stream.setListener(url -> {
            if (url.endsWith("boom")) throw new IllegalStateException("boom");
            second.countDown();
        });
        stream.enable();

        engine.push("grpc://s1/boom");
        engine.push("grpc://s1/ok");

        assertThat(second.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(stream.state()).isEqualTo(StreamState.ACTIVE);
    }

    @Test
    void transportFailureBreaksStreamAndItCanBeReEnabled() throws Exception {
        stream.enable();
        engine.breakStream();

        eventually(() -> stream.state() == StreamState.BROKEN);
        assertThat(stream.isEnabled()).isFalse();

        stream.enable();

        assertThat(stream.state()).isEqualTo(StreamState.ACTIVE);
        assertThat(engine.streamPrefixes).hasSize(2);
    }

    @Test
    void engineEndingTheStreamClosesIt() throws Exception {
        stream.enable();
        engine.endStream();

        eventually(() -> stream.state() == StreamState.CLOSED);
    }

    @Test
    void closeStopsTheStream() throws Exception {
        stream.enable();

        stream.close();
        stream.close();

        assertThat(stream.state()).isEqualTo(StreamState.CLOSED);
        assertThat(stream.isEnabled()).isFalse();
    }

    @Test
    void failedOpenLeavesStreamBroken() {
        engine.failStreamOpen(new EngineConnectionException("no stream"));

        assertThatThrownBy(stream::enable).isInstanceOf(EngineConnectionException.class);
        assertThat(stream.state()).isEqualTo(StreamState.BROKEN);
    }

    @Test
    void enableWithoutEngineFails() {
        engine.refuseConnections(Integer.MAX_VALUE);

        assertThatThrownBy(stream::enable)
                .isInstanceOf(EngineConnectionException.class)
                .hasMessageContaining("Not connected");
        assertThat(stream.state()).isEqualTo(StreamState.BROKEN);
    }
}
