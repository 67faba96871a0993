package io.ensightrpc.client;

import io.ensightrpc.client.proxy.ProxyCache;
import io.ensightrpc.core.Protocol;
import io.smallrye.config.ConfigValidationException;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings for one {@link EnsightSession}.
 *
 * @param host engine host
 * @param port engine gRPC port
 * @param secretKey shared secret sent on every call; empty for none
 * @param connectTimeout how long one connection attempt may wait for readiness
 * @param sessionTimeout how long {@link EnsightSession#open()} keeps retrying
 * @param proxyCacheLimit proxy cache size above which the cache is flushed
 * @param haltOnClose whether closing the session asks the engine to exit
 */
public record SessionConfig(
        String host,
        int port,
        String secretKey,
        Duration connectTimeout,
        Duration sessionTimeout,
        int proxyCacheLimit,
        boolean haltOnClose
) {
    public static final String PREFIX = "ensight.rpc.";
    public static final String KEY_HOST = PREFIX + "host";
    public static final String KEY_PORT = PREFIX + "port";
    public static final String KEY_SECRET_KEY = PREFIX + "secret-key";
    public static final String KEY_CONNECT_TIMEOUT = PREFIX + "connect-timeout";
    public static final String KEY_SESSION_TIMEOUT = PREFIX + "session-timeout";
    public static final String KEY_PROXY_CACHE_LIMIT = PREFIX + "proxy-cache-limit";
    public static final String KEY_HALT_ON_CLOSE = PREFIX + "halt-on-close";

    /** Environment variable consulted when no secret key is configured. */
    public static final String ENV_SECURITY_TOKEN = "ENSIGHT_SECURITY_TOKEN";

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofSeconds(120);

    private static final int PROPERTIES_ORDINAL = 400;
    private static final int ENV_ORDINAL = 300;

    public SessionConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(secretKey, "secretKey");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(sessionTimeout, "sessionTimeout");
        if (host.isBlank()) throw new IllegalArgumentException("host must not be blank");
        if (port < 1 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (connectTimeout.isNegative() || connectTimeout.isZero()) throw new IllegalArgumentException("connectTimeout must be positive");
        if (sessionTimeout.isNegative()) throw new IllegalArgumentException("sessionTimeout must not be negative");
        if (proxyCacheLimit < 1) throw new IllegalArgumentException("proxyCacheLimit must be >= 1");
    }

    public static SessionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code ensight.rpc.*} keys through {@link SessionProperties}, falling back to its
     * defaults and, for the secret key, to {@value #ENV_SECURITY_TOKEN} in {@code env}.
     *
     * @throws IllegalArgumentException naming the key whose value is invalid
     */
    public static SessionConfig fromProperties(Properties props, Map<String, String> env) {
        Objects.requireNonNull(props, "props");
        Objects.requireNonNull(env, "env");
        SmallRyeConfig config = load(props, env);
        SessionProperties p = config.getConfigMapping(SessionProperties.class);
        String secret = p.secretKey()
                .or(() -> config.getOptionalValue(ENV_SECURITY_TOKEN, String.class))
                .orElse("");
        try {
            return builder()
                    .host(p.host().trim())
                    .port(p.port())
                    .secretKey(secret.trim())
                    .connectTimeout(p.connectTimeout())
                    .sessionTimeout(p.sessionTimeout())
                    .proxyCacheLimit(p.proxyCacheLimit())
                    .haltOnClose(p.haltOnClose())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + PREFIX + "* configuration: " + e.getMessage(), e);
        }
    }

    private static SmallRyeConfig load(Properties props, Map<String, String> env) {
        try {
            return new SmallRyeConfigBuilder()
                    .withSources(new PropertiesConfigSource(props, "ensight-rpc-properties", PROPERTIES_ORDINAL))
                    .withSources(new PropertiesConfigSource(env, "ensight-rpc-environment", ENV_ORDINAL))
                    .withMapping(SessionProperties.class)
                    .build();
        } catch (ConfigValidationException e) {
            throw new IllegalArgumentException("Invalid " + PREFIX + "* configuration: " + e.getMessage(), e);
        }
    }

    public static SessionConfig fromProperties(Properties props) {
        return fromProperties(props, System.getenv());
    }

    public static final class Builder {
        private String host = Protocol.DEFAULT_HOST;
        private int port = Protocol.DEFAULT_PORT;
        private String secretKey = "";
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration sessionTimeout = DEFAULT_SESSION_TIMEOUT;
        private int proxyCacheLimit = ProxyCache.DEFAULT_LIMIT;
        private boolean haltOnClose;

        private Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder secretKey(String secretKey) {
            this.secretKey = secretKey == null ? "" : secretKey;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder sessionTimeout(Duration sessionTimeout) {
            this.sessionTimeout = sessionTimeout;
            return this;
        }

        public Builder proxyCacheLimit(int proxyCacheLimit) {
            this.proxyCacheLimit = proxyCacheLimit;
            return this;
        }

        public Builder haltOnClose(boolean haltOnClose) {
            this.haltOnClose = haltOnClose;
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(host, port, secretKey, connectTimeout, sessionTimeout, proxyCacheLimit, haltOnClose);
        }
    }
}
