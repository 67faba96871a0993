package io.ensightrpc.client;

import io.ensightrpc.json.spi.JsonCodec;
import io.ensightrpc.json.spi.JsonException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON result of a structured-mode command, decoded lazily through the session's codec.
 */
public final class StructuredResult {
    private final String json;
    private final JsonCodec codec;

    StructuredResult(String json, JsonCodec codec) {
        this.json = Objects.requireNonNull(json, "json");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public String json() {
        return json;
    }

    public Object value() throws JsonException {
        return codec.readUntyped(json);
    }

    public Map<String, Object> asMap() throws JsonException {
        return codec.readObject(json);
    }

    public <T> T as(Class<T> type) throws JsonException {
        return codec.readValue(json, type);
    }

    public <T> List<T> asList(Class<T> elementType) throws JsonException {
        return codec.readList(json, elementType);
    }

    @Override
    public String toString() {
        return json;
    }
}
