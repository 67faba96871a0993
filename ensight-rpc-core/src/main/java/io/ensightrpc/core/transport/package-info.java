/**
 * Transport SPI between the session runtime and the engine.
 *
 * <p>The SPI is blocking and minimal: one unary call per engine operation plus one
 * server-streaming call for events. Every call carries the per-call metadata map computed
 * by the channel manager. Implementations wrap a concrete RPC stack (gRPC in
 * {@code ensight-rpc-grpc}); tests substitute in-memory fakes.
 */
package io.ensightrpc.core.transport;
