package io.ensightrpc.client.proxy;

import io.ensightrpc.core.EngineConnectionException;
import io.ensightrpc.core.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Rewrites the object descriptions in an evaluated-mode result into proxy handles.
 *
 * <p>A cache hit reuses the cached handle. A miss on a polymorphic base class costs one
 * extra evaluated round-trip that reads the discriminator attribute; an unrecognized
 * value keeps the base class name.
 */
public final class ResultMarshaller {
    private static final Logger log = LoggerFactory.getLogger(ResultMarshaller.class);

    private final RemoteEvaluator owner;
    private final ProxyCache cache;
    private final SubtypeTable subtypes;
    private final Supplier<AttributeEnums> enums;

    public ResultMarshaller(RemoteEvaluator owner, ProxyCache cache, SubtypeTable subtypes, Supplier<AttributeEnums> enums) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.subtypes = Objects.requireNonNull(subtypes, "subtypes");
        this.enums = Objects.requireNonNull(enums, "enums");
    }

    /**
     * Marshals one result.
     *
     * @param text the textual result of an evaluated-mode command
     * @return the local value, with every object reference replaced by a {@link ProxyHandle}
     * @throws io.ensightrpc.core.EnsightRpcException.MalformedResult if the rewritten text is not a literal
     * @throws EngineConnectionException if a subtype query fails in transport
     */
    public Object marshal(String text) throws EngineConnectionException {
        Objects.requireNonNull(text, "text");
        cache.pruneIfOversized();

        List<ProxyHandle> refs = new ArrayList<>();
        StringBuilder rewritten = new StringBuilder(text.length());
        for (ReprToken token : ReprScanner.scan(text)) {
            if (token instanceof ReprToken.Literal literal) {
                rewritten.append(literal.text());
            } else if (token instanceof ReprToken.ObjectRef ref) {
                rewritten.append(ReprParser.placeholder(refs.size()));
                refs.add(resolve(ref));
            }
        }
        return ReprParser.parse(rewritten.toString(), refs);
    }

    ProxyHandle resolve(ReprToken.ObjectRef ref) throws EngineConnectionException {
        Optional<ProxyHandle> hit = cache.get(ref.objectId());
        if (hit.isPresent()) return hit.get();

        String className = ref.className();
        ProxyHandle.Discriminator discriminator = null;
        Optional<SubtypeTable.Entry> entry = subtypes.lookup(className);
        if (entry.isPresent()) {
            SubtypeTable.Entry e = entry.get();
            AttributeEnums table = enums.get();
            String query = Protocol.WRAP_ID + "(" + ref.objectId() + ").getattr(" + table.expression(e.discriminator()) + ")";
            Object value = owner.eval(query);
            Optional<String> subclass = value instanceof Number n && isInt(n)
                    ? e.subclassFor(n.intValue())
                    : Optional.empty();
            if (subclass.isPresent()) {
                className = subclass.get();
                discriminator = new ProxyHandle.Discriminator(e.discriminator(), table.idOf(e.discriminator()), ((Number) value).intValue());
            } else {
                log.debug("No subclass of {} for {}={}, keeping base class", className, e.discriminator(), value);
            }
        }
        return cache.putIfAbsent(new ProxyHandle(owner, ref.objectId(), className, discriminator));
    }

    private static boolean isInt(Number n) {
        if (!(n instanceof Long || n instanceof Integer)) return false;
        long v = n.longValue();
        return v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE;
    }

    public ProxyCache cache() {
        return cache;
    }
}
