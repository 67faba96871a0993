/**
 * Client runtime for a remote EnSight engine.
 *
 * <ul>
 *   <li>{@link io.ensightrpc.client.EnsightSession}: the entry point; one per engine</li>
 *   <li>{@link io.ensightrpc.client.EngineChannel}: connection and shared-secret metadata</li>
 *   <li>{@link io.ensightrpc.client.CommandExecutor}: command execution, rendering and geometry export</li>
 *   <li>{@link io.ensightrpc.client.SessionConfig}: host, port, secret and timeouts</li>
 * </ul>
 */
package io.ensightrpc.client;
