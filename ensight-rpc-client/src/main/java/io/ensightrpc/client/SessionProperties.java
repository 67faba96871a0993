package io.ensightrpc.client;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Session settings under the {@code ensight.rpc} prefix.
 *
 * <p>Configure via properties:
 * <pre>
 * ensight.rpc.host=render-node-3
 * ensight.rpc.port=50051
 * ensight.rpc.connect-timeout=PT2S
 * </pre>
 */
@ConfigMapping(prefix = "ensight.rpc")
public interface SessionProperties {

    @WithDefault("127.0.0.1")
    String host();

    @WithDefault("12345")
    int port();

    /**
     * Shared secret. When absent, {@value SessionConfig#ENV_SECURITY_TOKEN} is consulted.
     */
    Optional<String> secretKey();

    /**
     * ISO-8601, e.g. {@code PT15S}.
     */
    @WithDefault("PT15S")
    Duration connectTimeout();

    @WithDefault("PT2M")
    Duration sessionTimeout();

    @WithDefault("1000000")
    int proxyCacheLimit();

    @WithDefault("false")
    boolean haltOnClose();
}
