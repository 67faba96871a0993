package io.ensightrpc.json.spi;

/**
 * Base exception for JSON decoding errors.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
