package io.ensightrpc.client.proxy;

import io.ensightrpc.core.Protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Attribute enum name to numeric attribute id, as loaded from the engine at session start.
 *
 * <p>When a name is unknown, commands refer to it symbolically through
 * {@code ensight.objs.enums.<NAME>} and the engine resolves it.
 */
public final class AttributeEnums {
    private static final AttributeEnums EMPTY = new AttributeEnums(Map.of());

    /** Structured-mode command that returns every integer attribute enum. */
    public static final String LOAD_COMMAND = "{key: getattr(" + Protocol.ENUMS + ", key) for key in dir(" + Protocol.ENUMS
            + ") if isinstance(getattr(" + Protocol.ENUMS + ", key), int) and (not key.startswith('__') or key == '__OBJID__')}";

    private final Map<String, Integer> ids;

    private AttributeEnums(Map<String, Integer> ids) {
        this.ids = ids;
    }

    public static AttributeEnums empty() {
        return EMPTY;
    }

    public static AttributeEnums of(Map<String, Integer> ids) {
        Objects.requireNonNull(ids, "ids");
        return new AttributeEnums(Collections.unmodifiableMap(new LinkedHashMap<>(ids)));
    }

    /**
     * Builds the table from a decoded JSON object, keeping integral values only.
     */
    public static AttributeEnums fromJson(Map<String, Object> decoded) {
        Map<String, Integer> ids = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : decoded.entrySet()) {
            if (e.getValue() instanceof Integer i) {
                ids.put(e.getKey(), i);
            } else if (e.getValue() instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                ids.put(e.getKey(), l.intValue());
            }
        }
        return of(ids);
    }

    public OptionalInt idOf(String name) {
        Integer id = ids.get(name);
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    /**
     * @return the numeric id when known, else the symbolic {@code ensight.objs.enums.<NAME>}
     */
    public String expression(String name) {
        Integer id = ids.get(name);
        return id != null ? id.toString() : Protocol.ENUMS + "." + name;
    }

    public int size() {
        return ids.size();
    }

    public Map<String, Integer> asMap() {
        return ids;
    }
}
