package io.ensightrpc.client.event;

import java.util.List;
import java.util.Objects;

/**
 * One armed engine-side callback.
 *
 * @param shortTag routing key: the tag up to its first {@code ?}
 * @param tag the tag as registered, query string included
 * @param remoteId the id the engine returned from {@code addcallback}
 * @param attributes attributes the engine watches
 * @param callback local callable
 * @param compress whether the engine was asked to coalesce events
 */
public record Registration(String shortTag, String tag, Object remoteId, List<Object> attributes,
                           EventCallback callback, boolean compress) {
    public Registration {
        Objects.requireNonNull(shortTag, "shortTag");
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(callback, "callback");
        attributes = List.copyOf(Objects.requireNonNull(attributes, "attributes"));
    }
}
