package io.ensightrpc.client.event;

/**
 * Lifecycle of an {@link EventStream}.
 */
public enum StreamState {
    IDLE,
    STARTING,
    ACTIVE,
    /** Closed locally, or ended by the engine. */
    CLOSED,
    /** Failed in transport. May be enabled again. */
    BROKEN
}
