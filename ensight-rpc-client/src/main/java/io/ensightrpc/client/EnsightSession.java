package io.ensightrpc.client;

import io.ensightrpc.client.event.CallbackRegistry;
import io.ensightrpc.client.event.EventCallback;
import io.ensightrpc.client.event.EventStream;
import io.ensightrpc.client.event.Registration;
import io.ensightrpc.client.event.StreamState;
import io.ensightrpc.client.proxy.AttributeEnums;
import io.ensightrpc.client.proxy.ProxyCache;
import io.ensightrpc.client.proxy.ProxyHandle;
import io.ensightrpc.client.proxy.RemoteEvaluator;
import io.ensightrpc.client.proxy.ResultMarshaller;
import io.ensightrpc.client.proxy.SubtypeTable;
import io.ensightrpc.core.CommandResult;
import io.ensightrpc.core.EngineConnectionException;
import io.ensightrpc.core.EnsightRpcException;
import io.ensightrpc.core.ExecMode;
import io.ensightrpc.core.NotificationUrl;
import io.ensightrpc.core.Protocol;
import io.ensightrpc.core.PythonRepr;
import io.ensightrpc.core.RemoteReference;
import io.ensightrpc.core.transport.EngineConnector;
import io.ensightrpc.core.transport.RenderOptions;
import io.ensightrpc.json.spi.JsonCodec;
import io.ensightrpc.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * One client session against one engine.
 *
 * <p>Owns the channel, the proxy cache and the event stream. Evaluated results come back as
 * local values with {@link ProxyHandle}s in place of remote objects:
 * <pre>{@code
 * try (EnsightSession session = EnsightSession.builder()
 *         .config(SessionConfig.builder().port(12345).secretKey(token).build())
 *         .build()
 *         .open()) {
 *     ProxyList parts = (ProxyList) session.cmd("ensight.objs.core.PARTS");
 *     session.register("ensight.objs.core", "partlist", List.of("PARTS"), url -> refresh(), true);
 * }
 * }</pre>
 */
public final class EnsightSession implements RemoteEvaluator, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EnsightSession.class);

    static final Duration RETRY_PAUSE = Duration.ofMillis(100);

    static final String CORE = "ensight.objs.core";
    static final String IMPORT_PLATFORM = "import platform";
    static final String PYTHON_VERSION = "platform.python_version_tuple()";

    private final SessionConfig config;
    private final EngineChannel channel;
    private final CommandExecutor executor;
    private final ResultMarshaller marshaller;
    private final EventStream events;
    private final CallbackRegistry callbacks;
    private final JsonCodec json;
    private final String prefix;

    private volatile AttributeEnums enums = AttributeEnums.empty();
    private volatile String ceiHome;
    private volatile String suffix;
    private volatile ProxyHandle core;
    private volatile String pythonVersion;

    EnsightSession(SessionConfig config, EngineConnector connector, SubtypeTable subtypes, JsonCodec json) {
        this.config = Objects.requireNonNull(config, "config");
        this.json = Objects.requireNonNull(json, "json");
        this.channel = new EngineChannel(config.host(), config.port(), config.secretKey(), connector);
        this.executor = new CommandExecutor(channel, config.connectTimeout());
        this.marshaller = new ResultMarshaller(this, new ProxyCache(config.proxyCacheLimit()), subtypes, () -> enums);
        this.prefix = Protocol.NOTIFY_SCHEME + "://" + UUID.randomUUID() + "/";
        this.events = new EventStream(channel, config.connectTimeout(), prefix);
        this.callbacks = new CallbackRegistry(this, events);
    }

    public static EnsightSessionBuilder builder() {
        return new EnsightSessionBuilder();
    }

    /**
     * Connects and validates the connection, retrying until the session timeout, then loads
     * the attribute enum table, the {@code ensight.objs.core} proxy and the engine's Python
     * version.
     *
     * @return this session
     * @throws EngineConnectionException if no validated connection was made in time
     */
    public EnsightSession open() throws EngineConnectionException {
        establish(true);
        loadEnums();
        loadCore();
        log.info("Session open on {}:{} (CEI_HOME={}, suffix={})", config.host(), config.port(), ceiHome, suffix);
        return this;
    }

    // Retry loop: connect, then optionally prove the engine answers commands.
    private void establish(boolean validate) throws EngineConnectionException {
        long deadline = System.nanoTime() + config.sessionTimeout().toNanos();
        EngineConnectionException last = null;
        while (true) {
            if (!channel.isConnected()) {
                channel.connect(config.connectTimeout());
            }
            if (channel.isConnected()) {
                if (!validate) return;
                try {
                    ceiHome = String.valueOf(eval("ensight.version('CEI_HOME')"));
                    suffix = String.valueOf(eval("ensight.version('suffix')"));
                    return;
                } catch (EngineConnectionException e) {
                    last = e;
                    log.debug("Validation against {}:{} failed, retrying", config.host(), config.port(), e);
                }
            }
            if (System.nanoTime() - deadline >= 0) break;
            pause();
        }
        EngineConnectionException e = new EngineConnectionException(
                "Unable to establish a gRPC connection to EnSight at " + config.host() + ":" + config.port());
        if (last != null) e.addSuppressed(last);
        throw e;
    }

    private static void pause() throws EngineConnectionException {
        try {
            Thread.sleep(RETRY_PAUSE.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new EngineConnectionException("Interrupted while connecting", ie);
        }
    }

    private void loadEnums() throws EngineConnectionException {
        try {
            enums = AttributeEnums.fromJson(cmdJson(AttributeEnums.LOAD_COMMAND).asMap());
            log.debug("Loaded {} attribute enums", enums.size());
        } catch (JsonException | EnsightRpcException.RemoteExecutionFailed e) {
            log.warn("Attribute enums unavailable, attributes will be referenced by name", e);
        }
    }

    private void loadCore() throws EngineConnectionException {
        try {
            Object c = cmd(CORE);
            if (c instanceof ProxyHandle handle) {
                core = handle;
            } else {
                log.debug("{} did not resolve to a proxy: {}", CORE, c);
            }
            exec(IMPORT_PLATFORM);
            if (eval(PYTHON_VERSION) instanceof List<?> parts && !parts.isEmpty()) {
                StringJoiner version = new StringJoiner(".");
                for (Object part : parts) version.add(String.valueOf(part));
                pythonVersion = version.toString();
            }
        } catch (EnsightRpcException.RemoteExecutionFailed | EnsightRpcException.MalformedResult e) {
            log.warn("Engine core object or Python version unavailable", e);
        }
    }

    /**
     * Evaluates {@code command} and marshals the result.
     */
    public Object cmd(String command) throws EngineConnectionException {
        return cmd(command, true);
    }

    /**
     * @param evaluate when false the command runs as a statement and {@code null} is returned
     */
    public Object cmd(String command, boolean evaluate) throws EngineConnectionException {
        if (!evaluate) {
            execute(command, ExecMode.NO_RESULT);
            return null;
        }
        CommandResult.Text text = (CommandResult.Text) execute(command, ExecMode.EVALUATED);
        return marshaller.marshal(text.text());
    }

    /**
     * Evaluates {@code command} remotely as JSON. No proxy rewriting applies.
     */
    public StructuredResult cmdJson(String command) throws EngineConnectionException {
        CommandResult.Structured r = (CommandResult.Structured) execute(command, ExecMode.STRUCTURED);
        return new StructuredResult(r.json(), json);
    }

    /**
     * Runs one command in the given mode without marshalling.
     */
    public CommandResult execute(String command, ExecMode mode) throws EngineConnectionException {
        establish(false);
        return executor.execute(command, mode);
    }

    @Override
    public Object eval(String expression) throws EngineConnectionException {
        return cmd(expression, true);
    }

    @Override
    public void exec(String statement) throws EngineConnectionException {
        cmd(statement, false);
    }

    public byte[] render(RenderOptions options) throws EngineConnectionException {
        establish(false);
        return executor.render(options);
    }

    public byte[] render(int width, int height, int aaPasses) throws EngineConnectionException {
        return render(RenderOptions.png(width, height, aaPasses));
    }

    public byte[] geometry() throws EngineConnectionException {
        establish(false);
        return executor.geometry();
    }

    /**
     * @return the cached proxy for {@code objectId}, without a round-trip
     */
    public Optional<ProxyHandle> proxy(long objectId) {
        return marshaller.cache().get(objectId);
    }

    /**
     * Starts the event stream without registering a callback. Events are queued for
     * {@link #pollEvent()} unless a callback has been registered.
     */
    public void enableEvents() throws EngineConnectionException {
        events.enable();
    }

    public Optional<String> pollEvent() {
        return events.poll();
    }

    public boolean isEventStreamEnabled() {
        return events.isEnabled();
    }

    public StreamState eventStreamState() {
        return events.state();
    }

    public Registration register(RemoteReference target, String tag, List<?> attributes, EventCallback callback,
                                 boolean compress) throws EngineConnectionException {
        establish(false);
        return callbacks.register(target, tag, attributes, callback, compress);
    }

    /**
     * Registers against an engine-side expression such as {@code ensight.objs.core} or
     * {@code 'ENS_VPORT'}.
     */
    public Registration register(String targetExpression, String tag, List<?> attributes, EventCallback callback,
                                 boolean compress) throws EngineConnectionException {
        return register(PythonRepr.expr(targetExpression), tag, attributes, callback, compress);
    }

    public Registration register(String targetExpression, String tag, List<?> attributes, EventCallback callback)
            throws EngineConnectionException {
        return register(targetExpression, tag, attributes, callback, true);
    }

    public void unregister(String tag) throws EngineConnectionException {
        callbacks.unregister(tag);
    }

    public List<Registration> registrations() {
        return callbacks.registrations();
    }

    /**
     * Parses a notification this session received.
     */
    public NotificationUrl parseEvent(String url) {
        return NotificationUrl.parse(url);
    }

    public void connect(Duration timeout) {
        channel.connect(timeout);
    }

    public boolean isConnected() {
        return channel.isConnected();
    }

    /**
     * Stops the event stream and releases the channel.
     *
     * @param stopRemote also ask the engine to exit
     */
    public void shutdown(boolean stopRemote) {
        events.close();
        channel.shutdown(stopRemote);
    }

    public void setSecurityToken(String token) {
        channel.setSecretKey(token);
    }

    /**
     * @return notification URL prefix unique to this session
     */
    public String prefix() {
        return prefix;
    }

    public AttributeEnums enums() {
        return enums;
    }

    public Optional<String> ceiHome() {
        return Optional.ofNullable(ceiHome);
    }

    public Optional<String> suffix() {
        return Optional.ofNullable(suffix);
    }

    /**
     * @return the engine's {@code ensight.objs.core} object, resolved by {@link #open()}
     */
    public Optional<ProxyHandle> core() {
        return Optional.ofNullable(core);
    }

    /**
     * @return the engine interpreter version, e.g. {@code 3.10.4}, resolved by {@link #open()}
     */
    public Optional<String> pythonVersion() {
        return Optional.ofNullable(pythonVersion);
    }

    public SessionConfig config() {
        return config;
    }

    public int cachedProxies() {
        return marshaller.cache().size();
    }

    @Override
    public void close() {
        shutdown(config.haltOnClose());
    }
}
