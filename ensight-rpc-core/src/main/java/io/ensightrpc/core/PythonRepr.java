package io.ensightrpc.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Renders Java values as Python literals for embedding in command strings.
 *
 * <p>Supported: {@code null}, booleans, integral and floating point numbers, character
 * sequences, enums (by name), {@link RemoteReference}s, {@link Expression}s (inserted
 * verbatim), iterables and arrays (as lists) and maps (as dicts).
 */
public final class PythonRepr {
    private PythonRepr() {}

    /**
     * A fragment of Python source inserted as-is.
     *
     * @param source the expression text
     */
    public record Expression(String source) implements RemoteReference {
        public Expression {
            Objects.requireNonNull(source, "source");
            if (source.isBlank()) {
                throw new IllegalArgumentException("source must not be blank");
            }
        }

        @Override
        public String remoteExpression() {
            return source;
        }

        @Override
        public String toString() {
            return source;
        }
    }

    public static Expression expr(String source) {
        return new Expression(source);
    }

    public static String repr(Object value) {
        StringBuilder sb = new StringBuilder();
        append(sb, value);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("None");
        } else if (value instanceof Boolean b) {
            sb.append(b ? "True" : "False");
        } else if (value instanceof Byte || value instanceof Short || value instanceof Integer
                || value instanceof Long || value instanceof BigInteger || value instanceof BigDecimal) {
            sb.append(value);
        } else if (value instanceof Number n) {
            appendFloat(sb, n.doubleValue());
        } else if (value instanceof RemoteReference r) {
            sb.append(r.remoteExpression());
        } else if (value instanceof CharSequence cs) {
            appendString(sb, cs);
        } else if (value instanceof Character c) {
            appendString(sb, String.valueOf(c));
        } else if (value instanceof Enum<?> e) {
            appendString(sb, e.name());
        } else if (value instanceof Map<?, ?> map) {
            sb.append('{');
            Iterator<? extends Map.Entry<?, ?>> it = map.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<?, ?> e = it.next();
                append(sb, e.getKey());
                sb.append(": ");
                append(sb, e.getValue());
                if (it.hasNext()) sb.append(", ");
            }
            sb.append('}');
        } else if (value instanceof Iterable<?> items) {
            sb.append('[');
            Iterator<?> it = items.iterator();
            while (it.hasNext()) {
                append(sb, it.next());
                if (it.hasNext()) sb.append(", ");
            }
            sb.append(']');
        } else if (value instanceof Object[] arr) {
            sb.append('[');
            for (int i = 0; i < arr.length; i++) {
                if (i > 0) sb.append(", ");
                append(sb, arr[i]);
            }
            sb.append(']');
        } else if (value instanceof int[] arr) {
            sb.append('[');
            for (int i = 0; i < arr.length; i++) {
                if (i > 0) sb.append(", ");
                sb.append(arr[i]);
            }
            sb.append(']');
        } else {
            throw new IllegalArgumentException("No Python literal for " + value.getClass().getName());
        }
    }

    private static void appendFloat(StringBuilder sb, double d) {
        if (Double.isNaN(d)) {
            sb.append("float('nan')");
        } else if (Double.isInfinite(d)) {
            sb.append(d > 0 ? "float('inf')" : "float('-inf')");
        } else {
            sb.append(d);
        }
    }

    private static void appendString(StringBuilder sb, CharSequence s) {
        sb.append('\'');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('\'');
    }
}
