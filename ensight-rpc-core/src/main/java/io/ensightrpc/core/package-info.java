/**
 * Protocol-centric core for the EnSight RPC client.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and small models (execution modes, command results)</li>
 *   <li>The exception taxonomy shared by all modules</li>
 *   <li>Notification URL parsing and Python literal rendering for command arguments</li>
 *   <li>The transport SPI in {@code io.ensightrpc.core.transport}</li>
 * </ul>
 *
 * <p>The gRPC binding and the session runtime live in other modules.
 */
package io.ensightrpc.core;
