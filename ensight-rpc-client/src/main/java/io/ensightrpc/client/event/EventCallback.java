package io.ensightrpc.client.event;

/**
 * Receives one notification URL, already normalized.
 */
@FunctionalInterface
public interface EventCallback {
    void onEvent(String url);
}
