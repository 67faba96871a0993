/**
 * Engine event notifications.
 *
 * <p>{@link io.ensightrpc.client.event.EventStream} keeps one server stream open on a
 * background thread. {@link io.ensightrpc.client.event.CallbackRegistry} arms engine-side
 * callbacks and routes each notification URL to the local callback whose short tag
 * prefixes the URL path.
 */
package io.ensightrpc.client.event;
