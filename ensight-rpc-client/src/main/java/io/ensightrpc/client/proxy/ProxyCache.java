package io.ensightrpc.client.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Object id to proxy handle map, one per session.
 *
 * <p>Never evicts individual entries. When it holds more than its ceiling it is cleared in
 * full before the next marshalling pass, after which previously returned handles are no
 * longer identical to newly returned ones for the same id.
 */
public final class ProxyCache {
    private static final Logger log = LoggerFactory.getLogger(ProxyCache.class);

    public static final int DEFAULT_LIMIT = 1_000_000;

    private final int limit;
    private final ConcurrentMap<Long, ProxyHandle> handles = new ConcurrentHashMap<>();

    public ProxyCache() {
        this(DEFAULT_LIMIT);
    }

    public ProxyCache(int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1");
        this.limit = limit;
    }

    public Optional<ProxyHandle> get(long objectId) {
        return Optional.ofNullable(handles.get(objectId));
    }

    /**
     * Stores {@code handle} unless another handle for the same id got there first.
     *
     * @return the handle now cached for the id
     */
    ProxyHandle putIfAbsent(ProxyHandle handle) {
        ProxyHandle existing = handles.putIfAbsent(handle.objectId(), handle);
        return existing != null ? existing : handle;
    }

    /**
     * Clears the cache if it has grown past its ceiling.
     *
     * @return whether a flush happened
     */
    boolean pruneIfOversized() {
        int size = handles.size();
        if (size <= limit) return false;
        handles.clear();
        log.debug("Proxy cache flushed at {} entries (limit {})", size, limit);
        return true;
    }

    public void clear() {
        handles.clear();
    }

    public int size() {
        return handles.size();
    }

    public int limit() {
        return limit;
    }
}
