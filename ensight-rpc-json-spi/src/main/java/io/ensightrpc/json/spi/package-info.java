/**
 * JSON decoding SPI used for structured-mode command results.
 *
 * <p>The client depends only on this interface; {@code ensight-rpc-json-jackson}
 * provides the default implementation.
 */
package io.ensightrpc.json.spi;
