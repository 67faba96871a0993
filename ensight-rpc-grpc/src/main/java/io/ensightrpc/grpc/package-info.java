/**
 * gRPC binding of the transport SPI.
 *
 * <p>Message and stub classes are generated from {@code ensight.proto} at build time into
 * {@code io.ensightrpc.grpc.proto}.
 */
package io.ensightrpc.grpc;
