package io.ensightrpc.client.event;

import io.ensightrpc.client.proxy.RemoteEvaluator;
import io.ensightrpc.core.EngineConnectionException;
import io.ensightrpc.core.EnsightRpcException;
import io.ensightrpc.core.NotificationUrl;
import io.ensightrpc.core.Protocol;
import io.ensightrpc.core.PythonRepr;
import io.ensightrpc.core.RemoteReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Short tag to callback routing for one session.
 *
 * <p>Short tags are unique: {@code foo} and {@code foo?w={{WIDTH}}} collide. Routing picks the
 * first registration, in registration order, whose short tag prefixes the notification's tag.
 */
public final class CallbackRegistry {
    private static final Logger log = LoggerFactory.getLogger(CallbackRegistry.class);

    private final RemoteEvaluator remote;
    private final EventStream stream;
    private final Map<String, Registration> registrations = new LinkedHashMap<>();

    public CallbackRegistry(RemoteEvaluator remote, EventStream stream) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.stream = Objects.requireNonNull(stream, "stream");
    }

    /**
     * Arms an engine-side callback and records the local callable for it. Enables the event
     * stream when it is not already running.
     *
     * @param target the watched object, or an expression such as {@code ensight.objs.core}
     * @param tag routing tag, optionally with a macro query such as {@code ?w={{WIDTH}}}
     * @param attributes attribute names or ids to watch
     * @param callback invoked on the event thread with the normalized URL
     * @param compress ask the engine to coalesce bursts of events
     * @throws EnsightRpcException.DuplicateCallback if the short tag is taken
     * @throws EngineConnectionException if the stream could not be started; the registration is
     *         then dropped and the engine-side callback removed
     */
    public synchronized Registration register(RemoteReference target, String tag, List<?> attributes,
                                              EventCallback callback, boolean compress) throws EngineConnectionException {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(attributes, "attributes");
        Objects.requireNonNull(callback, "callback");
        String shortTag = NotificationUrl.shortTag(tag);
        if (shortTag.isEmpty()) throw new IllegalArgumentException("tag must not be empty");
        if (registrations.containsKey(shortTag)) {
            throw new EnsightRpcException.DuplicateCallback(shortTag);
        }

        Object remoteId = remote.eval(addCallbackCommand(target, tag, attributes, compress));
        Registration reg = new Registration(shortTag, tag, remoteId, new ArrayList<>(attributes), callback, compress);
        registrations.put(shortTag, reg);
        log.debug("Registered callback {} as remote id {}", shortTag, remoteId);

        stream.setListener(this::dispatch);
        if (!stream.isEnabled()) {
            try {
                stream.enable();
            } catch (EngineConnectionException | RuntimeException e) {
                registrations.remove(shortTag);
                disarm(reg, e);
                throw e;
            }
        }
        return reg;
    }

    // Best effort: the engine-side callback would otherwise fire into a missing registration.
    private void disarm(Registration reg, Exception cause) {
        try {
            remote.exec(removeCallbackCommand(reg));
        } catch (EngineConnectionException | RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    private static String removeCallbackCommand(Registration reg) {
        return Protocol.REMOVE_CALLBACK + "(" + PythonRepr.repr(reg.remoteId()) + ")";
    }

    String addCallbackCommand(RemoteReference target, String tag, List<?> attributes, boolean compress) {
        StringBuilder cmd = new StringBuilder(Protocol.ADD_CALLBACK)
                .append('(').append(target.remoteExpression())
                .append(",None,")
                .append(PythonRepr.repr(stream.prefix() + tag))
                .append(",attrs=").append(PythonRepr.repr(attributes));
        if (compress) {
            cmd.append(",flags=").append(Protocol.FLAG_COMPRESS);
        }
        return cmd.append(')').toString();
    }

    /**
     * Disarms the callback registered under {@code tag}. A tag with a query is reduced to its
     * short tag first.
     *
     * @throws EnsightRpcException.UnknownCallback if nothing is registered under the tag
     */
    public void unregister(String tag) throws EngineConnectionException {
        Objects.requireNonNull(tag, "tag");
        Registration reg;
        synchronized (this) {
            reg = registrations.remove(NotificationUrl.shortTag(tag));
        }
        if (reg == null) {
            throw new EnsightRpcException.UnknownCallback(tag);
        }
        remote.exec(removeCallbackCommand(reg));
        log.debug("Unregistered callback {}", reg.shortTag());
    }

    /**
     * Routes one raw notification to its callback. Unroutable notifications are logged and
     * dropped.
     */
    public void dispatch(String raw) {
        String url = NotificationUrl.normalize(raw);
        String tag;
        try {
            tag = NotificationUrl.parse(url).tag();
        } catch (IllegalArgumentException e) {
            log.warn("Unhandled event: {}", url);
            return;
        }
        Optional<Registration> match = find(tag);
        if (match.isEmpty()) {
            log.warn("Unhandled event: {}", url);
            return;
        }
        try {
            match.get().callback().onEvent(url);
        } catch (RuntimeException e) {
            log.error("Callback {} failed for {}", match.get().shortTag(), url, e);
        }
    }

    private synchronized Optional<Registration> find(String tag) {
        for (Registration reg : registrations.values()) {
            if (tag.startsWith(reg.shortTag())) return Optional.of(reg);
        }
        return Optional.empty();
    }

    public synchronized boolean isRegistered(String shortTag) {
        return registrations.containsKey(shortTag);
    }

    /**
     * @return current registrations in registration order
     */
    public synchronized List<Registration> registrations() {
        return List.copyOf(registrations.values());
    }
}
