package io.ensightrpc.client.proxy;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.RandomAccess;

/**
 * Read-only list produced when a whole evaluated result is a list.
 *
 * <p>Elements keep their original order; object references inside are {@link ProxyHandle}s.
 */
public final class ProxyList extends AbstractList<Object> implements RandomAccess {
    private final List<Object> items;

    public ProxyList(List<?> items) {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    @Override
    public Object get(int index) {
        return items.get(index);
    }

    @Override
    public int size() {
        return items.size();
    }

    /**
     * Top-level elements that are proxies, in order.
     */
    public List<ProxyHandle> handles() {
        List<ProxyHandle> out = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof ProxyHandle h) out.add(h);
        }
        return out;
    }

    /**
     * Top-level proxies whose class is {@code baseClass} or one of its subclasses.
     */
    public List<ProxyHandle> ofClass(String baseClass) {
        List<ProxyHandle> out = new ArrayList<>();
        for (ProxyHandle h : handles()) {
            if (h.isA(baseClass)) out.add(h);
        }
        return out;
    }
}
