package io.ensightrpc.client;

import io.ensightrpc.core.CommandResult;
import io.ensightrpc.core.EngineConnectionException;
import io.ensightrpc.core.EnsightRpcException;
import io.ensightrpc.core.ExecMode;
import io.ensightrpc.core.transport.RenderOptions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandExecutorTest {

    private final FakeEngine engine = new FakeEngine();
    private final EngineChannel channel = new EngineChannel("127.0.0.1", 12345, "tok", engine);
    private final CommandExecutor executor = new CommandExecutor(channel, Duration.ofMillis(50));

    @Test
    void resultShapeFollowsMode() throws Exception {
        engine.reply("10+4", "14").reply("[1, 2]", "[1,2]");

        CommandResult none = executor.execute("import os", ExecMode.NO_RESULT);
        CommandResult text = executor.execute("10+4", ExecMode.EVALUATED);
        CommandResult json = executor.execute("[1, 2]", ExecMode.STRUCTURED);

        assertThat(none).isSameAs(CommandResult.None.INSTANCE);
        assertThat(text).isEqualTo(new CommandResult.Text("14"));
        assertThat(json).isEqualTo(new CommandResult.Structured("[1,2]"));
    }

    @Test
    void everyCallCarriesTheSecret() throws Exception {
        executor.execute("1", ExecMode.EVALUATED);

        assertThat(engine.calls).allSatisfy(c -> assertThat(c.metadata()).isEqualTo(Map.of("shared_secret", "tok")));
    }

    @Test
    void negativeErrorIsRemoteFailure() {
        engine.fail("1/0");

        assertThatThrownBy(() -> executor.execute("1/0", ExecMode.EVALUATED))
                .isInstanceOf(EnsightRpcException.RemoteExecutionFailed.class)
                .hasMessage("Remote execution error");
    }

    @Test
    void droppedCallSurfacesAndIsNotRetried() {
        engine.drop("ensight.refresh()");

        assertThatThrownBy(() -> executor.execute("ensight.refresh()", ExecMode.NO_RESULT))
                .isInstanceOf(EngineConnectionException.class);
        assertThat(engine.commands()).containsExactly("ensight.refresh()");
    }

    @Test
    void noEngineMeansNotConnected() {
        engine.refuseConnections(Integer.MAX_VALUE);

        assertThatThrownBy(() -> executor.execute("1", ExecMode.EVALUATED))
                .isInstanceOf(EngineConnectionException.class)
                .hasMessageContaining("Not connected");
    }

    @Test
    void renderAndGeometry() throws Exception {
        byte[] png = executor.render(RenderOptions.png(1024, 768, 4));
        byte[] glb = executor.geometry();

        assertThat(new String(png, StandardCharsets.UTF_8)).isEqualTo("png 1024x768 aa=4");
        assertThat(new String(glb, StandardCharsets.UTF_8)).isEqualTo("glTF");
    }
}
