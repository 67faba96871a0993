package io.ensightrpc.core;

import java.util.Objects;

/**
 * Outcome of a remote command, discriminated by the {@link ExecMode} it was requested with.
 *
 * <p>Remote failures never produce a result; they surface as
 * {@link EnsightRpcException.RemoteExecutionFailed}.
 */
public sealed interface CommandResult permits CommandResult.None, CommandResult.Text, CommandResult.Structured {

    ExecMode mode();

    static CommandResult of(ExecMode mode, String value) {
        Objects.requireNonNull(mode, "mode");
        return switch (mode) {
            case NO_RESULT -> None.INSTANCE;
            case EVALUATED -> new Text(value == null ? "" : value);
            case STRUCTURED -> new Structured(value == null ? "" : value);
        };
    }

    /**
     * Result of a {@link ExecMode#NO_RESULT} command.
     */
    final class None implements CommandResult {
        public static final None INSTANCE = new None();

        private None() {}

        @Override
        public ExecMode mode() {
            return ExecMode.NO_RESULT;
        }

        @Override
        public String toString() {
            return "None";
        }
    }

    /**
     * Textual representation of an evaluated expression, still to be marshalled locally.
     *
     * @param text the representation as produced by the engine
     */
    record Text(String text) implements CommandResult {
        public Text {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public ExecMode mode() {
            return ExecMode.EVALUATED;
        }
    }

    /**
     * JSON encoding of an evaluated expression. No object-reference rewriting applies.
     *
     * @param json the JSON document
     */
    record Structured(String json) implements CommandResult {
        public Structured {
            Objects.requireNonNull(json, "json");
        }

        @Override
        public ExecMode mode() {
            return ExecMode.STRUCTURED;
        }
    }
}
