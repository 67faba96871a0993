package io.ensightrpc.core;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A notification pushed by the engine event stream.
 *
 * <p>Shape: {@code grpc://{session-id}/{tag}?enum={attribute}&uid={object-id}}. The engine
 * always appends its own {@code ?enum=...} suffix, even when the registered tag already
 * carried a query (typically expanded {@code {{ATTR}}} macros). {@link #normalize(String)}
 * turns that suffix into {@code &enum=} so the URL has a single query block.
 *
 * @param url the normalized URL
 * @param sessionId the authority part, i.e. the session-unique identifier
 * @param tag the path without its leading slash; the tag that actually fired
 * @param query decoded query parameters in order of appearance, first occurrence wins
 */
public record NotificationUrl(String url, String sessionId, String tag, Map<String, String> query) {

    private static final String ENUM_SUFFIX = "?" + Protocol.Q_ENUM + "=";

    public NotificationUrl {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(tag, "tag");
        query = query == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(query));
    }

    /**
     * Rewrites the engine's {@code ?enum=} suffix into {@code &enum=} when an earlier {@code ?}
     * already opened the query. Other {@code ?} characters are left alone, since expanded macro
     * values may contain them.
     *
     * @param url raw notification string
     * @return the URL with a single query separator
     */
    public static String normalize(String url) {
        Objects.requireNonNull(url, "url");
        int suffix = url.indexOf(ENUM_SUFFIX);
        if (suffix < 0 || url.indexOf('?') >= suffix) {
            return url;
        }
        return url.replace(ENUM_SUFFIX, "&" + Protocol.Q_ENUM + "=");
    }

    /**
     * Parses a raw notification string.
     *
     * @param raw the string received from the event stream
     * @return the parsed notification
     * @throws IllegalArgumentException if the string has no {@code scheme://} prefix
     */
    public static NotificationUrl parse(String raw) {
        String url = normalize(raw);
        int schemeEnd = url.indexOf("://");
        if (schemeEnd < 0) {
            throw new IllegalArgumentException("Not a notification URL: " + raw);
        }
        int authorityStart = schemeEnd + 3;
        int queryStart = url.indexOf('?', authorityStart);
        int end = queryStart < 0 ? url.length() : queryStart;
        int pathStart = url.indexOf('/', authorityStart);
        if (pathStart < 0 || pathStart > end) {
            pathStart = end;
        }

        String sessionId = url.substring(authorityStart, pathStart);
        String tag = pathStart < end ? url.substring(pathStart + 1, end) : "";
        Map<String, String> query = queryStart < 0 ? Map.of() : parseQuery(url.substring(queryStart + 1));
        return new NotificationUrl(url, sessionId, tag, query);
    }

    /**
     * Returns the tag with any query removed. This is the registration dedup key.
     *
     * @param tag a registration tag, possibly carrying a macro query
     * @return the portion before the first {@code ?}
     */
    public static String shortTag(String tag) {
        Objects.requireNonNull(tag, "tag");
        int idx = tag.indexOf('?');
        return idx < 0 ? tag : tag.substring(0, idx);
    }

    public Optional<String> param(String name) {
        return Optional.ofNullable(query.get(name));
    }

    /**
     * @return the attribute whose change fired the notification, when reported
     */
    public Optional<String> attribute() {
        return param(Protocol.Q_ENUM);
    }

    /**
     * @return the identity of the object whose attribute changed, when reported
     */
    public OptionalLong objectId() {
        String v = query.get(Protocol.Q_UID);
        if (v == null || v.isBlank()) return OptionalLong.empty();
        try {
            return OptionalLong.of(Long.parseLong(v.trim()));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static Map<String, String> parseQuery(String q) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String pair : q.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            out.putIfAbsent(key, value);
        }
        return out;
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // stray '%' in an expanded macro value
            return s;
        }
    }
}
