package io.ensightrpc.core;

/**
 * How the engine should treat a command string.
 */
public enum ExecMode {
    /** Execute as a statement; nothing is returned. */
    NO_RESULT,
    /** Evaluate as an expression and return its textual representation. */
    EVALUATED,
    /** Evaluate as an expression and return the value encoded as JSON. */
    STRUCTURED
}
