package io.ensightrpc.client;

import io.ensightrpc.client.proxy.SubtypeTable;
import io.ensightrpc.core.transport.EngineConnector;
import io.ensightrpc.grpc.GrpcEngineConnector;
import io.ensightrpc.json.jackson.JacksonJsonCodec;
import io.ensightrpc.json.spi.JsonCodec;

import java.util.Objects;

/**
 * Builder for {@link EnsightSession}. Defaults to gRPC, Jackson and the standard subtype table.
 */
public final class EnsightSessionBuilder {
    private SessionConfig config = SessionConfig.defaults();
    private EngineConnector connector;
    private SubtypeTable subtypes = SubtypeTable.defaults();
    private JsonCodec jsonCodec;

    EnsightSessionBuilder() {}

    public EnsightSessionBuilder config(SessionConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    public EnsightSessionBuilder connector(EngineConnector connector) {
        this.connector = Objects.requireNonNull(connector, "connector");
        return this;
    }

    public EnsightSessionBuilder subtypes(SubtypeTable subtypes) {
        this.subtypes = Objects.requireNonNull(subtypes, "subtypes");
        return this;
    }

    public EnsightSessionBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    /**
     * Creates the session without connecting; call {@link EnsightSession#open()} next.
     */
    public EnsightSession build() {
        EngineConnector c = connector != null ? connector : new GrpcEngineConnector();
        JsonCodec j = jsonCodec != null ? jsonCodec : new JacksonJsonCodec();
        return new EnsightSession(config, c, subtypes, j);
    }
}
