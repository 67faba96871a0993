package io.ensightrpc.json.spi;

import java.util.List;
import java.util.Map;

/**
 * Minimal JSON codec for decoding engine replies.
 * Implementations wrap specific JSON libraries (Jackson, Gson, etc.).
 *
 * <p>This interface intentionally avoids exposing tree model abstractions.
 * Decode into strongly-typed POJOs, or into plain maps and lists.
 */
public interface JsonCodec {

    /**
     * Deserializes a JSON document to an object of the specified type.
     * @param json JSON text
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON array to a list of typed objects.
     * @param json JSON text (must be an array)
     * @param elementType element class
     * @return list of deserialized objects
     * @throws JsonException if deserialization fails
     */
    <T> List<T> readList(String json, Class<T> elementType) throws JsonException;

    /**
     * Deserializes a JSON object to an insertion-ordered map of plain values.
     * @param json JSON text (must be an object)
     * @throws JsonException if the text is not a JSON object
     */
    Map<String, Object> readObject(String json) throws JsonException;

    /**
     * Deserializes any JSON value to plain Java values: maps, lists, strings, numbers,
     * booleans and {@code null}.
     * @param json JSON text
     * @throws JsonException if the text is not valid JSON
     */
    Object readUntyped(String json) throws JsonException;
}
