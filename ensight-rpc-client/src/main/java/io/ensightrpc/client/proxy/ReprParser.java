package io.ensightrpc.client.proxy;

import io.ensightrpc.core.EnsightRpcException;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent reader for the Python literal syntax the engine prints.
 *
 * <p>Object references have already been replaced by placeholders of the form
 * {@code U+E000 <index> U+E001}, each standing for an entry of the supplied handle list.
 * Value mapping:
 * <ul>
 *   <li>{@code None}, {@code True}, {@code False}: {@code null} and {@link Boolean}</li>
 *   <li>integers: {@link Long}, or {@link BigInteger} when out of range</li>
 *   <li>floats: {@link Double}</li>
 *   <li>strings: {@link String}; bytes literals: {@code byte[]}</li>
 *   <li>lists and tuples: unmodifiable {@link List}</li>
 *   <li>dicts: unmodifiable insertion-ordered {@link Map}; sets: unmodifiable {@link Set}</li>
 * </ul>
 */
final class ReprParser {
    static final char REF_OPEN = '\uE000';
    static final char REF_CLOSE = '\uE001';

    private final String text;
    private final List<ProxyHandle> refs;
    private int pos;

    private ReprParser(String text, List<ProxyHandle> refs) {
        this.text = text;
        this.refs = refs;
    }

    static String placeholder(int index) {
        return REF_OPEN + Integer.toString(index) + REF_CLOSE;
    }

    /**
     * Parses one complete value. A result whose text is a list literal comes back as a
     * {@link ProxyList}.
     */
    static Object parse(String text, List<ProxyHandle> refs) {
        ReprParser p = new ReprParser(text, refs);
        p.skipWs();
        if (p.eof()) throw p.malformed("empty result");
        boolean topLevelList = p.peek() == '[';
        Object value = p.value();
        p.skipWs();
        if (!p.eof()) throw p.malformed("unexpected trailing text");
        if (topLevelList && value instanceof List<?> list) {
            return new ProxyList(list);
        }
        return value;
    }

    private Object value() {
        skipWs();
        if (eof()) throw malformed("unexpected end of text");
        char c = peek();
        switch (c) {
            case REF_OPEN:
                return reference();
            case '[':
                pos++;
                return Collections.unmodifiableList(sequence(']').items);
            case '(':
                return tuple();
            case '{':
                return braces();
            case '\'':
            case '"':
                return string(false, false);
            default:
                break;
        }
        if (c == '-' || c == '+' || c == '.' || Character.isDigit(c)) {
            return number();
        }
        if (Character.isLetter(c) || c == '_') {
            int start = pos;
            while (!eof() && (Character.isLetterOrDigit(peek()) || peek() == '_')) pos++;
            String word = text.substring(start, pos);
            if (!eof() && (peek() == '\'' || peek() == '"') && isStringPrefix(word)) {
                String lower = word.toLowerCase();
                return string(lower.indexOf('r') >= 0, lower.indexOf('b') >= 0);
            }
            switch (word) {
                case "None":
                    return null;
                case "True":
                    return Boolean.TRUE;
                case "False":
                    return Boolean.FALSE;
                default:
                    pos = start;
                    throw malformed("unsupported name '" + word + "'");
            }
        }
        throw malformed("unexpected character '" + c + "'");
    }

    private ProxyHandle reference() {
        int start = pos;
        pos++;
        int digits = pos;
        while (!eof() && Character.isDigit(peek())) pos++;
        if (pos == digits || eof() || peek() != REF_CLOSE) {
            pos = start;
            throw malformed("broken object reference");
        }
        int index = Integer.parseInt(text.substring(digits, pos));
        pos++;
        if (index >= refs.size()) {
            pos = start;
            throw malformed("unknown object reference " + index);
        }
        return refs.get(index);
    }

    private static final class Sequence {
        final List<Object> items = new ArrayList<>();
        boolean trailingComma;
    }

    // Reads comma-separated values up to and including the closing character.
    private Sequence sequence(char close) {
        Sequence seq = new Sequence();
        skipWs();
        if (!eof() && peek() == close) {
            pos++;
            return seq;
        }
        while (true) {
            seq.items.add(value());
            skipWs();
            if (eof()) throw malformed("missing '" + close + "'");
            char c = peek();
            if (c == close) {
                pos++;
                seq.trailingComma = false;
                return seq;
            }
            if (c != ',') throw malformed("expected ',' or '" + close + "'");
            pos++;
            skipWs();
            if (!eof() && peek() == close) {
                pos++;
                seq.trailingComma = true;
                return seq;
            }
        }
    }

    private Object tuple() {
        pos++;
        Sequence seq = sequence(')');
        if (seq.items.size() == 1 && !seq.trailingComma) {
            // parenthesized expression, not a tuple
            return seq.items.get(0);
        }
        return Collections.unmodifiableList(seq.items);
    }

    private Object braces() {
        pos++;
        skipWs();
        if (!eof() && peek() == '}') {
            pos++;
            return Collections.unmodifiableMap(new LinkedHashMap<>());
        }
        Object first = value();
        skipWs();
        if (!eof() && peek() == ':') {
            return dict(first);
        }
        Set<Object> set = new LinkedHashSet<>();
        set.add(first);
        while (true) {
            skipWs();
            if (eof()) throw malformed("missing '}'");
            char c = peek();
            if (c == '}') {
                pos++;
                return Collections.unmodifiableSet(set);
            }
            if (c != ',') throw malformed("expected ',' or '}'");
            pos++;
            skipWs();
            if (!eof() && peek() == '}') {
                pos++;
                return Collections.unmodifiableSet(set);
            }
            set.add(value());
        }
    }

    private Map<Object, Object> dict(Object firstKey) {
        Map<Object, Object> map = new LinkedHashMap<>();
        Object key = firstKey;
        while (true) {
            skipWs();
            if (eof() || peek() != ':') throw malformed("expected ':'");
            pos++;
            map.put(key, value());
            skipWs();
            if (eof()) throw malformed("missing '}'");
            char c = peek();
            if (c == '}') {
                pos++;
                return Collections.unmodifiableMap(map);
            }
            if (c != ',') throw malformed("expected ',' or '}'");
            pos++;
            skipWs();
            if (!eof() && peek() == '}') {
                pos++;
                return Collections.unmodifiableMap(map);
            }
            key = value();
        }
    }

    private Object number() {
        int start = pos;
        if (peek() == '-' || peek() == '+') pos++;
        boolean floating = false;
        int digits = 0;
        while (!eof() && Character.isDigit(peek())) {
            pos++;
            digits++;
        }
        if (!eof() && peek() == '.') {
            floating = true;
            pos++;
            while (!eof() && Character.isDigit(peek())) {
                pos++;
                digits++;
            }
        }
        if (digits == 0) {
            pos = start;
            throw malformed("bad number");
        }
        if (!eof() && (peek() == 'e' || peek() == 'E')) {
            floating = true;
            pos++;
            if (!eof() && (peek() == '-' || peek() == '+')) pos++;
            int exp = pos;
            while (!eof() && Character.isDigit(peek())) pos++;
            if (pos == exp) {
                pos = start;
                throw malformed("bad exponent");
            }
        }
        if (!eof() && (Character.isLetter(peek()) || peek() == '_')) {
            pos = start;
            throw malformed("unsupported numeric literal");
        }
        String literal = text.substring(start, pos);
        if (floating) {
            return Double.parseDouble(literal);
        }
        BigInteger big = new BigInteger(literal.startsWith("+") ? literal.substring(1) : literal);
        return big.bitLength() < 64 ? (Object) big.longValue() : big;
    }

    private static boolean isStringPrefix(String word) {
        if (word.length() > 2) return false;
        String lower = word.toLowerCase();
        return switch (lower) {
            case "r", "u", "b", "br", "rb" -> true;
            default -> false;
        };
    }

    private Object string(boolean raw, boolean bytes) {
        int start = pos;
        char quote = peek();
        boolean triple = text.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (eof()) {
                pos = start;
                throw malformed("unterminated string");
            }
            char c = peek();
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (text.startsWith(String.valueOf(quote).repeat(3), pos)) {
                    pos += 3;
                    break;
                }
                sb.append(c);
                pos++;
            } else if (c == '\\') {
                escape(sb, raw, bytes);
            } else if (c == REF_OPEN && !bytes) {
                sb.append(reference().remoteExpression());
            } else {
                if (!triple && c == '\n') throw malformed("newline in string");
                sb.append(c);
                pos++;
            }
        }
        if (bytes) {
            return sb.toString().getBytes(StandardCharsets.ISO_8859_1);
        }
        return sb.toString();
    }

    private void escape(StringBuilder sb, boolean raw, boolean bytes) {
        pos++;
        if (eof()) throw malformed("unterminated string");
        char c = peek();
        if (raw) {
            sb.append('\\').append(c);
            pos++;
            return;
        }
        pos++;
        switch (c) {
            case '\n' -> { }
            case '\\' -> sb.append('\\');
            case '\'' -> sb.append('\'');
            case '"' -> sb.append('"');
            case 'n' -> sb.append('\n');
            case 'r' -> sb.append('\r');
            case 't' -> sb.append('\t');
            case 'a' -> sb.append('\u0007');
            case 'b' -> sb.append('\b');
            case 'f' -> sb.append('\f');
            case 'v' -> sb.append('\u000b');
            case 'x' -> sb.appendCodePoint(hex(2));
            case 'u' -> {
                if (bytes) sb.append('\\').append(c);
                else sb.appendCodePoint(hex(4));
            }
            case 'U' -> {
                if (bytes) sb.append('\\').append(c);
                else sb.appendCodePoint(hex(8));
            }
            default -> {
                if (c >= '0' && c <= '7') {
                    int value = c - '0';
                    for (int i = 0; i < 2 && !eof() && peek() >= '0' && peek() <= '7'; i++) {
                        value = value * 8 + (peek() - '0');
                        pos++;
                    }
                    sb.append((char) value);
                } else {
                    sb.append('\\').append(c);
                }
            }
        }
    }

    private int hex(int len) {
        if (pos + len > text.length()) throw malformed("truncated escape");
        long cp = 0;
        for (int i = 0; i < len; i++) {
            int d = Character.digit(text.charAt(pos + i), 16);
            if (d < 0) throw malformed("bad escape");
            cp = cp * 16 + d;
        }
        if (!Character.isValidCodePoint((int) Math.min(cp, Integer.MAX_VALUE))) throw malformed("bad escape");
        pos += len;
        return (int) cp;
    }

    private void skipWs() {
        while (!eof() && Character.isWhitespace(peek())) pos++;
    }

    private boolean eof() {
        return pos >= text.length();
    }

    private char peek() {
        return text.charAt(pos);
    }

    private EnsightRpcException.MalformedResult malformed(String message) {
        return new EnsightRpcException.MalformedResult(message, text, pos);
    }
}
