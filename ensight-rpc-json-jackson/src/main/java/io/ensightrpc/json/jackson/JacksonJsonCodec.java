package io.ensightrpc.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ensightrpc.json.spi.JsonCodec;
import io.ensightrpc.json.spi.JsonException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 *
 * <p>The default mapper ignores unknown properties, since engine replies carry whatever
 * fields the remote object exposes.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     */
    public JacksonJsonCodec() {
        this(new ObjectMapper(new JsonFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public <T> T readValue(String json, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize string to " + type.getName(), e);
        }
    }

    @Override
    public <T> List<T> readList(String json, Class<T> elementType) throws JsonException {
        try {
            JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, elementType);
            return mapper.readValue(json, listType);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize string to List<" + elementType.getName() + ">", e);
        }
    }

    @Override
    public Map<String, Object> readObject(String json) throws JsonException {
        try {
            return mapper.readValue(json, MAP_TYPE);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize string to a JSON object", e);
        }
    }

    @Override
    public Object readUntyped(String json) throws JsonException {
        try {
            return mapper.readValue(json, Object.class);
        } catch (Exception e) {
            throw new JsonException("Failed to parse JSON value", e);
        }
    }
}
